package com.social.tipping.model;

public enum ReviewStatus {
    PENDING,
    CLEARED,
    CONFIRMED_ABUSE
}
