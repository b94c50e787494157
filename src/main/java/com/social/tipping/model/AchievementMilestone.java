package com.social.tipping.model;

/**
 * Tip-count milestones, each awarded at most once per user.
 */
public enum AchievementMilestone {
    FIRST_TIP_SENT(LeaderboardCategory.SENT, 1),
    TEN_TIPS_SENT(LeaderboardCategory.SENT, 10),
    HUNDRED_TIPS_SENT(LeaderboardCategory.SENT, 100),
    THOUSAND_TIPS_SENT(LeaderboardCategory.SENT, 1000),
    FIRST_TIP_RECEIVED(LeaderboardCategory.RECEIVED, 1),
    TEN_TIPS_RECEIVED(LeaderboardCategory.RECEIVED, 10),
    HUNDRED_TIPS_RECEIVED(LeaderboardCategory.RECEIVED, 100),
    THOUSAND_TIPS_RECEIVED(LeaderboardCategory.RECEIVED, 1000);

    private final LeaderboardCategory category;
    private final long threshold;

    AchievementMilestone(LeaderboardCategory category, long threshold) {
        this.category = category;
        this.threshold = threshold;
    }

    public LeaderboardCategory getCategory() {
        return category;
    }

    public long getThreshold() {
        return threshold;
    }
}
