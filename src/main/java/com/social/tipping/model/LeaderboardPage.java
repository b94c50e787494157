package com.social.tipping.model;

import java.util.List;

public record LeaderboardPage(LeaderboardPeriod period, LeaderboardCategory category, String periodKey,
                              long totalCount, List<LeaderboardEntry> entries) {}
