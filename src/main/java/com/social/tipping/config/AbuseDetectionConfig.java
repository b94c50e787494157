package com.social.tipping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Thresholds for the abuse checks. Amounts are in the token's smallest unit
 * (6 decimals, so 1 token = 1_000_000).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "abuse")
public class AbuseDetectionConfig {

    private boolean enabled = true;

    // How long a single check may run before the assessment stops waiting for it.
    private long checkTimeoutMs = 2000;

    private Circular circular = new Circular();
    private Farming farming = new Farming();
    private Velocity velocity = new Velocity();
    private Pattern pattern = new Pattern();
    private WalletVelocity walletVelocity = new WalletVelocity();
    private Anomaly anomaly = new Anomaly();

    @Data
    public static class Circular {
        private long windowMs = 3_600_000L;
    }

    @Data
    public static class Farming {
        // Only tips below this amount are inspected (0.1 token).
        private long amountThreshold = 100_000L;
        private int maxPerDay = 50;
        private int suspiciousCount = 20;
        // Cumulative amount below multiplier x current amount is suspicious once suspiciousCount is passed.
        private long cumulativeMultiplier = 2;
        private int ttlSeconds = 86_400;
    }

    @Data
    public static class Velocity {
        private int maxTips = 10;
        private long windowMs = 300_000L;
    }

    @Data
    public static class Pattern {
        private int maxIdenticalPerHour = 20;
        private int maxRoundPerHour = 15;
        private List<Long> roundAmounts = List.of(1_000_000L, 10_000_000L, 100_000_000L, 1_000_000_000L);
        private int ttlSeconds = 3600;
    }

    @Data
    public static class WalletVelocity {
        private int maxPerHour = 100;
        private int ttlSeconds = 3600;
    }

    @Data
    public static class Anomaly {
        private double multiplier = 10.0;
        // 100 tokens.
        private long minAmount = 100_000_000L;
        private double emaRetain = 0.9;
        private int ttlSeconds = 86_400;
    }
}
