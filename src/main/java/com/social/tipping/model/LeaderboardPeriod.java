package com.social.tipping.model;

public enum LeaderboardPeriod {
    ALL,
    WEEKLY;

    public static LeaderboardPeriod fromPath(String value) {
        String normalized = value.trim().toUpperCase();
        if ("ALL-TIME".equals(normalized) || "ALLTIME".equals(normalized)) {
            return ALL;
        }
        return LeaderboardPeriod.valueOf(normalized);
    }
}
