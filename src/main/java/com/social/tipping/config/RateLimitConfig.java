package com.social.tipping.config;

import com.social.tipping.model.VerificationTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitConfig {

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 60 * MINUTE_MS;

    // Per sender, tiered by verification level.
    private ScopeLimit user = new ScopeLimit(24 * HOUR_MS, List.of(100, 200, 500), HOUR_MS);

    // Per client network address. Same limit for every tier.
    private ScopeLimit ip = new ScopeLimit(15 * MINUTE_MS, List.of(100, 100, 100), 30 * MINUTE_MS);

    // Per lower-cased sender wallet address.
    private ScopeLimit wallet = new ScopeLimit(HOUR_MS, List.of(50, 100, 200), 2 * HOUR_MS);

    // Large tips per sender; only applied when the amount reaches the tier threshold.
    private ScopeLimit amount = new ScopeLimit(24 * HOUR_MS, List.of(2, 5, 10), 24 * HOUR_MS);

    // Smallest-unit thresholds (6 decimals): 1000 / 5000 / 10000 tokens.
    private List<Long> largeAmountThresholds = List.of(1_000_000_000L, 5_000_000_000L, 10_000_000_000L);

    // Recipient notifications sent by the notification enrichment.
    private ScopeLimit notify = new ScopeLimit(HOUR_MS, List.of(20, 20, 20), 0);

    public long largeAmountThresholdFor(VerificationTier tier) {
        return pick(largeAmountThresholds, tier);
    }

    static <T> T pick(List<T> tiered, VerificationTier tier) {
        int index = Math.min(tier.ordinal(), tiered.size() - 1);
        return tiered.get(index);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScopeLimit {
        private long windowMs;
        // Indexed by VerificationTier ordinal: UNVERIFIED, BASIC, VERIFIED.
        private List<Integer> maxRequests;
        // Zero disables the block flag.
        private long blockMs;

        public int maxFor(VerificationTier tier) {
            return pick(maxRequests, tier);
        }
    }
}
