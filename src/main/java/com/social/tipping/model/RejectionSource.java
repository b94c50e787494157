package com.social.tipping.model;

public enum RejectionSource {
    RATE_LIMIT,
    ABUSE,
    MODERATION
}
