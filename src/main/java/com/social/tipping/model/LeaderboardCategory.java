package com.social.tipping.model;

public enum LeaderboardCategory {
    SENT("senders"),
    RECEIVED("recipients");

    private final String boardPrefix;

    LeaderboardCategory(String boardPrefix) {
        this.boardPrefix = boardPrefix;
    }

    public String getBoardPrefix() {
        return boardPrefix;
    }

    /**
     * Accepts the enum name or the board prefix, so both {@code sent} and {@code senders} work.
     */
    public static LeaderboardCategory fromParam(String value) {
        String normalized = value.trim();
        for (LeaderboardCategory category : values()) {
            if (category.name().equalsIgnoreCase(normalized) || category.boardPrefix.equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown leaderboard category: " + value);
    }
}
