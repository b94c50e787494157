package com.social.tipping.model;

public enum FailureKind {
    // Worth retrying: network trouble, timeouts, throttling, open breakers.
    TRANSIENT,
    // Retrying cannot help: bad input, auth, missing accounts, insufficient funds.
    PERMANENT
}
