package com.social.tipping.model;

/**
 * Declaration order is the order scopes are evaluated in; the first rejecting scope
 * supplies the rejection reason.
 */
public enum RateLimitScope {
    USER("rate_limit:user", "Daily tip limit reached", "tips"),
    IP("rate_limit:ip", "Too many tips from this network address", "requests"),
    WALLET("rate_limit:wallet", "Wallet tip limit reached", "tips"),
    AMOUNT("rate_limit:amount", "Large tip limit reached", "large tips"),
    NOTIFY("rate_limit:notify", "Notification limit reached", "notifications");

    private final String keyPrefix;
    private final String label;
    private final String unit;

    RateLimitScope(String keyPrefix, String label, String unit) {
        this.keyPrefix = keyPrefix;
        this.label = label;
        this.unit = unit;
    }

    public String key(String subject) {
        return keyPrefix + ":" + subject;
    }

    public String getLabel() {
        return label;
    }

    public String getUnit() {
        return unit;
    }

    public static RateLimitScope fromName(String name) {
        return RateLimitScope.valueOf(name.trim().toUpperCase());
    }
}
