package com.social.tipping.service;

import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.config.RateLimitConfig;
import com.social.tipping.model.*;
import com.social.tipping.testutil.InMemoryCounterStore;
import com.social.tipping.testutil.MutableClock;
import com.social.tipping.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.social.tipping.testutil.TestDataFactory.TOKEN;
import static org.assertj.core.api.Assertions.assertThat;

class RateLimitServiceTest {

    private static final long MINUTE = 60_000L;

    private MutableClock clock;
    private InMemoryCounterStore store;
    private SimpleMeterRegistry meterRegistry;
    private RateLimitService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-14T12:00:00Z");
        store = new InMemoryCounterStore(clock);
        meterRegistry = new SimpleMeterRegistry();
        service = new RateLimitService(store, TestDataFactory.defaultRateLimitConfig(),
                new MetricsConfig(meterRegistry), clock);
    }

    @Test
    void checkLimit_allowsUpToMaxThenRejects() {
        for (int i = 0; i < 3; i++) {
            assertThat(service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 3, 0).isAllowed()).isTrue();
            clock.advanceMillis(1000);
        }

        RateLimitResult rejected = service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 3, 0);

        assertThat(rejected.isAllowed()).isFalse();
        assertThat(rejected.getRemaining()).isZero();
        // oldest entry at t0, now t0+3s: 57s left in the window
        assertThat(rejected.getRetryAfterSeconds()).isEqualTo(57L);
        assertThat(rejected.getReason()).isEqualTo("Daily tip limit reached: maximum 3 tips per minute.");
    }

    @Test
    void checkLimit_remainingStrictlyDecreases() {
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            remaining.add(service.checkLimit(RateLimitScope.WALLET, "0xabc", MINUTE, 5, 0).getRemaining());
        }

        assertThat(remaining).containsExactly(4, 3, 2, 1, 0);
    }

    @Test
    void checkLimit_windowSlides() {
        service.checkLimit(RateLimitScope.IP, "1.2.3.4", MINUTE, 2, 0);
        clock.advanceMillis(30_000);
        service.checkLimit(RateLimitScope.IP, "1.2.3.4", MINUTE, 2, 0);
        assertThat(service.checkLimit(RateLimitScope.IP, "1.2.3.4", MINUTE, 2, 0).isAllowed()).isFalse();

        clock.advanceMillis(30_001);

        RateLimitResult result = service.checkLimit(RateLimitScope.IP, "1.2.3.4", MINUTE, 2, 0);
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRemaining()).isZero();
    }

    @Test
    void getStatus_pruningIsIdempotent() {
        service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 10, 0);
        clock.advanceMillis(40_000);
        service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 10, 0);
        clock.advanceMillis(30_000);

        RateLimitStatus first = service.getStatus(RateLimitScope.USER, "u1", MINUTE, 10);
        RateLimitStatus second = service.getStatus(RateLimitScope.USER, "u1", MINUTE, 10);

        assertThat(first.count()).isEqualTo(1);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void checkLimit_blockOutlivesWindow() {
        service.checkLimit(RateLimitScope.WALLET, "0xabc", MINUTE, 1, 10 * MINUTE);
        RateLimitResult rejected = service.checkLimit(RateLimitScope.WALLET, "0xabc", MINUTE, 1, 10 * MINUTE);
        assertThat(rejected.isAllowed()).isFalse();

        clock.advance(Duration.ofMinutes(2));
        RateLimitResult stillBlocked = service.checkLimit(RateLimitScope.WALLET, "0xabc", MINUTE, 1, 10 * MINUTE);
        assertThat(stillBlocked.isAllowed()).isFalse();
        assertThat(stillBlocked.getRetryAfterSeconds()).isEqualTo(8 * 60L);

        clock.advance(Duration.ofMinutes(9));
        assertThat(service.checkLimit(RateLimitScope.WALLET, "0xabc", MINUTE, 1, 10 * MINUTE).isAllowed()).isTrue();
    }

    @Test
    void checkLimit_storeFailure_failsOpen() {
        store.setFailing(true);

        RateLimitResult result = service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 7, 0);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRemaining()).isEqualTo(7);
        assertThat(meterRegistry.find("ratelimit.failopen.count").counter()).isNotNull();
        assertThat(meterRegistry.find("ratelimit.failopen.count").counter().count()).isEqualTo(1.0);
    }

    @Test
    void checkAll_firstRejectingScopeSuppliesReason() {
        RateLimitConfig config = new RateLimitConfig();
        config.setIp(new RateLimitConfig.ScopeLimit(MINUTE, List.of(1, 1, 1), 0));
        config.setWallet(new RateLimitConfig.ScopeLimit(MINUTE, List.of(1, 1, 1), 0));
        service = new RateLimitService(store, config, new MetricsConfig(meterRegistry), clock);

        service.checkAll("u1", "1.2.3.4", "0xABC", TOKEN, VerificationTier.UNVERIFIED);
        RateLimitDecision decision = service.checkAll("u1", "1.2.3.4", "0xabc", TOKEN, VerificationTier.UNVERIFIED);

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getRejection().getScope()).isEqualTo(RateLimitScope.IP);
        assertThat(decision.getResults()).hasSize(4);
        assertThat(decision.getResults().get(2).isAllowed()).as("wallet key is case-insensitive").isFalse();
    }

    @Test
    void checkAll_largeAmountLimitOnlyAboveThreshold() {
        for (int i = 0; i < 5; i++) {
            service.checkAll("u1", "1.2.3.4", "0xabc", 10 * TOKEN, VerificationTier.UNVERIFIED);
        }
        assertThat(store.contains(AerospikeConfig.SET_RATE_WINDOWS, RateLimitScope.AMOUNT.key("u1:large"))).isFalse();

        service.checkAll("u1", "1.2.3.4", "0xabc", 1000 * TOKEN, VerificationTier.UNVERIFIED);
        service.checkAll("u1", "1.2.3.4", "0xabc", 1000 * TOKEN, VerificationTier.UNVERIFIED);
        RateLimitDecision third = service.checkAll("u1", "1.2.3.4", "0xabc", 1000 * TOKEN, VerificationTier.UNVERIFIED);

        assertThat(third.isAllowed()).isFalse();
        assertThat(third.getRejection().getScope()).isEqualTo(RateLimitScope.AMOUNT);
        assertThat(third.getRejection().getReason()).isEqualTo("Large tip limit reached: maximum 2 large tips per 24 hours.");
    }

    @Test
    void checkAll_verifiedTierGetsHigherLimit() {
        RateLimitConfig config = new RateLimitConfig();
        config.setUser(new RateLimitConfig.ScopeLimit(MINUTE, List.of(1, 2, 3), 0));
        service = new RateLimitService(store, config, new MetricsConfig(meterRegistry), clock);

        for (int i = 0; i < 3; i++) {
            assertThat(service.checkAll("u1", "ip", "0xabc", TOKEN, VerificationTier.VERIFIED).isAllowed()).isTrue();
        }
        assertThat(service.checkAll("u1", "ip", "0xabc", TOKEN, VerificationTier.VERIFIED).isAllowed()).isFalse();
    }

    @Test
    void clearLimit_removesWindowAndBlock() {
        service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 1, MINUTE * 60);
        service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 1, MINUTE * 60);

        service.clearLimit(RateLimitScope.USER, "u1");

        RateLimitStatus status = service.getStatus(RateLimitScope.USER, "u1", MINUTE, 1);
        assertThat(status.count()).isZero();
        assertThat(status.blocked()).isFalse();
        assertThat(service.checkLimit(RateLimitScope.USER, "u1", MINUTE, 1, MINUTE * 60).isAllowed()).isTrue();
    }

    @Test
    void describeWindow_formatsUnits() {
        assertThat(RateLimitService.describeWindow(24 * 60 * MINUTE)).isEqualTo("24 hours");
        assertThat(RateLimitService.describeWindow(60 * MINUTE)).isEqualTo("hour");
        assertThat(RateLimitService.describeWindow(15 * MINUTE)).isEqualTo("15 minutes");
        assertThat(RateLimitService.describeWindow(30_000L)).isEqualTo("30 seconds");
    }
}
