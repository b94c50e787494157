package com.social.tipping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "leaderboard")
public class LeaderboardConfig {

    private int defaultLimit = 10;

    private int maxLimit = 100;

    private int weeklyTtlSeconds = 14 * 86_400;

    // How long a job stays marked as credited; must outlive the longest job retention.
    private int creditMarkerTtlSeconds = 7 * 86_400;

    // Zone used to compute ISO week buckets.
    private String zone = "UTC";
}
