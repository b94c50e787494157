package com.social.tipping.service;

import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.config.RateLimitConfig;
import com.social.tipping.model.RateLimitDecision;
import com.social.tipping.model.RateLimitResult;
import com.social.tipping.model.RateLimitScope;
import com.social.tipping.model.RateLimitStatus;
import com.social.tipping.model.VerificationTier;
import com.social.tipping.repository.CounterStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window rate limiting over the shared counter store.
 *
 * <p>Every check prunes the window lazily, so no background cleanup is needed. A rejection can
 * also set a block flag for the key; while the flag lives, checks reject without touching the
 * window. Any store failure lets the request through: availability of tipping is preferred over
 * strict enforcement when the store is down.
 */
@Service
public class RateLimitService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private final CounterStore counterStore;
    private final RateLimitConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RateLimitService(CounterStore counterStore, RateLimitConfig config,
                            MetricsConfig metricsConfig, Clock clock) {
        this.counterStore = counterStore;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Check every scope for one tip. All scopes are evaluated, so each one records the attempt;
     * the first rejecting scope in {@link RateLimitScope} order supplies the reason.
     */
    @Observed(name = "ratelimit.check_all", contextualName = "check-all-rate-limits")
    public RateLimitDecision checkAll(String userId, String clientIp, String walletAddress,
                                      long amount, VerificationTier tier) {
        VerificationTier effectiveTier = tier != null ? tier : VerificationTier.UNVERIFIED;
        List<RateLimitResult> results = new ArrayList<>(4);

        results.add(checkLimit(RateLimitScope.USER, userId, config.getUser(), effectiveTier));
        results.add(checkLimit(RateLimitScope.IP, clientIp != null ? clientIp : "unknown",
                config.getIp(), effectiveTier));
        results.add(checkLimit(RateLimitScope.WALLET, walletAddress.toLowerCase(),
                config.getWallet(), effectiveTier));

        if (amount >= config.largeAmountThresholdFor(effectiveTier)) {
            results.add(checkLimit(RateLimitScope.AMOUNT, userId + ":large", config.getAmount(), effectiveTier));
        } else {
            results.add(RateLimitResult.builder()
                    .scope(RateLimitScope.AMOUNT)
                    .allowed(true)
                    .remaining(Integer.MAX_VALUE)
                    .resetAt(clock.millis())
                    .build());
        }

        RateLimitDecision decision = RateLimitDecision.of(results);
        if (!decision.isAllowed()) {
            log.info("Tip from user={} rate limited on scope={}: {}",
                    userId, decision.getRejection().getScope(), decision.getRejection().getReason());
        }
        return decision;
    }

    public RateLimitResult checkLimit(RateLimitScope scope, String subject,
                                      RateLimitConfig.ScopeLimit limit, VerificationTier tier) {
        return checkLimit(scope, subject, limit.getWindowMs(), limit.maxFor(tier), limit.getBlockMs());
    }

    /**
     * Count this request against the window of {@code scope:subject}.
     *
     * @param blockDurationMs when positive, a rejection also blocks the key for this long
     */
    public RateLimitResult checkLimit(RateLimitScope scope, String subject,
                                      long windowMs, int maxRequests, long blockDurationMs) {
        String key = scope.key(subject);
        long now = clock.millis();

        try {
            Long blockedUntil = counterStore.getLong(AerospikeConfig.SET_RATE_BLOCKS, key);
            if (blockedUntil != null && blockedUntil > now) {
                metricsConfig.recordRateLimitCheck(scope.name(), false);
                return RateLimitResult.builder()
                        .scope(scope)
                        .allowed(false)
                        .remaining(0)
                        .resetAt(blockedUntil)
                        .retryAfterSeconds(ceilSeconds(blockedUntil - now))
                        .reason(scope.getLabel() + ": temporarily blocked after exceeding the limit.")
                        .build();
            }

            List<Long> live = counterStore.pruneWindow(AerospikeConfig.SET_RATE_WINDOWS, key, now - windowMs);

            if (live.size() >= maxRequests) {
                long oldest = live.isEmpty() ? now : live.get(0);
                long resetAt = oldest + windowMs;
                if (blockDurationMs > 0) {
                    counterStore.putLong(AerospikeConfig.SET_RATE_BLOCKS, key, now + blockDurationMs,
                            (int) ceilSeconds(blockDurationMs));
                }
                metricsConfig.recordRateLimitCheck(scope.name(), false);
                return RateLimitResult.builder()
                        .scope(scope)
                        .allowed(false)
                        .remaining(0)
                        .resetAt(resetAt)
                        .retryAfterSeconds(Math.max(1L, ceilSeconds(resetAt - now)))
                        .reason(describeLimit(scope, maxRequests, windowMs))
                        .build();
            }

            counterStore.appendToWindow(AerospikeConfig.SET_RATE_WINDOWS, key, now, (int) ceilSeconds(windowMs));
            long oldest = live.isEmpty() ? now : live.get(0);
            metricsConfig.recordRateLimitCheck(scope.name(), true);
            return RateLimitResult.builder()
                    .scope(scope)
                    .allowed(true)
                    .remaining(maxRequests - live.size() - 1)
                    .resetAt(oldest + windowMs)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Rate limit store unavailable for {}, failing open: {}", key, e.getMessage());
            metricsConfig.recordRateLimitFailOpen(scope.name());
            return RateLimitResult.builder()
                    .scope(scope)
                    .allowed(true)
                    .remaining(maxRequests)
                    .resetAt(now + windowMs)
                    .build();
        }
    }

    /**
     * Current usage of a key. Prunes expired entries but records nothing.
     */
    public RateLimitStatus getStatus(RateLimitScope scope, String subject, long windowMs, int maxRequests) {
        String key = scope.key(subject);
        long now = clock.millis();
        List<Long> live = counterStore.pruneWindow(AerospikeConfig.SET_RATE_WINDOWS, key, now - windowMs);
        Long blockedUntil = counterStore.getLong(AerospikeConfig.SET_RATE_BLOCKS, key);
        boolean blocked = blockedUntil != null && blockedUntil > now;
        long oldest = live.isEmpty() ? now : live.get(0);
        return new RateLimitStatus(scope, subject, live.size(),
                Math.max(0, maxRequests - live.size()), oldest + windowMs,
                blocked, blocked ? blockedUntil : 0L);
    }

    public RateLimitStatus getStatus(RateLimitScope scope, String subject, VerificationTier tier) {
        RateLimitConfig.ScopeLimit limit = limitFor(scope);
        return getStatus(scope, subject, limit.getWindowMs(), limit.maxFor(tier));
    }

    /**
     * Remove both the window and any block flag of a key.
     */
    public void clearLimit(RateLimitScope scope, String subject) {
        String key = scope.key(subject);
        counterStore.delete(AerospikeConfig.SET_RATE_WINDOWS, key);
        counterStore.delete(AerospikeConfig.SET_RATE_BLOCKS, key);
        log.info("Cleared rate limit for {}", key);
    }

    public RateLimitConfig.ScopeLimit limitFor(RateLimitScope scope) {
        return switch (scope) {
            case USER -> config.getUser();
            case IP -> config.getIp();
            case WALLET -> config.getWallet();
            case AMOUNT -> config.getAmount();
            case NOTIFY -> config.getNotify();
        };
    }

    static String describeLimit(RateLimitScope scope, int maxRequests, long windowMs) {
        return String.format("%s: maximum %d %s per %s.",
                scope.getLabel(), maxRequests, scope.getUnit(), describeWindow(windowMs));
    }

    static String describeWindow(long windowMs) {
        long minutes = windowMs / 60_000L;
        if (minutes > 0 && minutes % 60 == 0) {
            long hours = minutes / 60;
            return hours == 1 ? "hour" : hours + " hours";
        }
        if (minutes > 0) {
            return minutes == 1 ? "minute" : minutes + " minutes";
        }
        return ceilSeconds(windowMs) + " seconds";
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }
}
