package com.social.tipping.model;

public enum JobStatus {
    WAITING,
    ACTIVE,
    DELAYED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
