package com.social.tipping.model;

public enum ModerationAction {
    ALLOW,
    WARN,
    BLOCK
}
