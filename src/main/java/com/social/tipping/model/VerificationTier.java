package com.social.tipping.model;

/**
 * Sender verification level. Ordinal order matters: tiered limits are indexed by it.
 */
public enum VerificationTier {
    UNVERIFIED,
    BASIC,
    VERIFIED
}
