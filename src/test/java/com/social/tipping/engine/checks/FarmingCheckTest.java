package com.social.tipping.engine.checks;

import com.social.tipping.config.AbuseDetectionConfig;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.testutil.InMemoryCounterStore;
import com.social.tipping.testutil.MutableClock;
import com.social.tipping.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FarmingCheckTest {

    private FarmingCheck check;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-10-14T12:00:00Z");
        check = new FarmingCheck(new InMemoryCounterStore(clock), new AbuseDetectionConfig());
    }

    @Test
    void largerTips_areNotInspected() {
        for (int i = 0; i < 100; i++) {
            assertThat(check.evaluate(TestDataFactory.createAttempt("a", "b", 100_000L)).isAllowed()).isTrue();
        }
    }

    @Test
    void steadySmallTips_pass() {
        AbuseCheckResult last = null;
        for (int i = 0; i < 21; i++) {
            last = check.evaluate(TestDataFactory.createAttempt("a", "b", 10_000L));
        }

        assertThat(last.isAllowed()).isTrue();
    }

    @Test
    void dustTipsThenLargerOne_isSuspicious() {
        for (int i = 0; i < 20; i++) {
            check.evaluate(TestDataFactory.createAttempt("a", "b", 1L));
        }

        AbuseCheckResult result = check.evaluate(TestDataFactory.createAttempt("a", "b", 50_000L));

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).isEqualTo("Suspicious tipping pattern detected.");
        assertThat(result.getMetadata()).containsEntry("cumulativeAmount", 50_020L);
    }

    @Test
    void overDailyPairCap_isRejected() {
        for (int i = 0; i < 50; i++) {
            check.evaluate(TestDataFactory.createAttempt("a", "b", 10_000L));
        }

        AbuseCheckResult result = check.evaluate(TestDataFactory.createAttempt("a", "b", 10_000L));

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).isEqualTo("Too many small tips to the same user today.");
        assertThat(check.evaluate(TestDataFactory.createAttempt("a", "c", 10_000L)).isAllowed()).isTrue();
    }
}
