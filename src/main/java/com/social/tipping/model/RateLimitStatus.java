package com.social.tipping.model;

public record RateLimitStatus(RateLimitScope scope, String subject, int count, int remaining,
                              long resetAt, boolean blocked, long blockedUntil) {}
