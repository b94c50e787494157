package com.social.tipping.model;

public enum AbuseCheckType {
    SELF_DEALING,
    CIRCULAR_TRANSFER,
    FARMING,
    VELOCITY,
    PATTERN_REPETITION,
    WALLET_VELOCITY,
    AMOUNT_ANOMALY
}
