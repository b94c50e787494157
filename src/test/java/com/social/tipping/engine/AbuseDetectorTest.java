package com.social.tipping.engine;

import com.social.tipping.config.AbuseDetectionConfig;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.*;
import com.social.tipping.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AbuseDetectorTest {

    @Mock private MetricsConfig metricsConfig;

    private AbuseDetectionConfig config;
    private final TipAttempt attempt = TestDataFactory.createAttempt("alice", "bob", 5 * TestDataFactory.TOKEN);

    @BeforeEach
    void setUp() {
        config = TestDataFactory.defaultAbuseConfig();
    }

    @Test
    void assess_allPass_isAllowedLow() {
        AbuseAssessment assessment = detector(fixed(AbuseCheckResult.pass(AbuseCheckType.VELOCITY)),
                fixed(AbuseCheckResult.pass(AbuseCheckType.FARMING))).assess(attempt);

        assertThat(assessment.isAllowed()).isTrue();
        assertThat(assessment.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(assessment.isFlaggedForReview()).isFalse();
        assertThat(assessment.getResults()).hasSize(2);
    }

    @Test
    void assess_mostSevereRejectionWins() {
        AbuseAssessment assessment = detector(
                fixed(AbuseCheckResult.reject(AbuseCheckType.PATTERN_REPETITION, Severity.LOW, "pattern", Map.of())),
                fixed(AbuseCheckResult.reject(AbuseCheckType.SELF_DEALING, Severity.CRITICAL, "Cannot tip yourself.", Map.of())),
                fixed(TestDataFactory.velocityRejection(30))).assess(attempt);

        assertThat(assessment.isAllowed()).isFalse();
        assertThat(assessment.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(assessment.getCheckType()).isEqualTo(AbuseCheckType.SELF_DEALING);
        assertThat(assessment.getReason()).isEqualTo("Cannot tip yourself.");
        verify(metricsConfig).recordAbuseRejection("SELF_DEALING", "CRITICAL");
    }

    @Test
    void assess_flagsAreCombinedIntoReviewReason() {
        AbuseAssessment assessment = detector(
                fixed(AbuseCheckResult.flag(AbuseCheckType.AMOUNT_ANOMALY, Severity.MEDIUM, "big tip", Map.of())),
                fixed(AbuseCheckResult.flag(AbuseCheckType.FARMING, Severity.LOW, "odd pair", Map.of())))
                .assess(attempt);

        assertThat(assessment.isAllowed()).isTrue();
        assertThat(assessment.isFlaggedForReview()).isTrue();
        assertThat(assessment.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(assessment.getReviewReason()).contains("big tip").contains("odd pair");
        verify(metricsConfig).recordAbuseFlagged();
    }

    @Test
    void assess_brokenCheckCountsAsPass() {
        AbuseCheck broken = new AbuseCheck() {
            @Override
            public AbuseCheckType getCheckType() {
                return AbuseCheckType.WALLET_VELOCITY;
            }

            @Override
            public AbuseCheckResult evaluate(TipAttempt a) {
                throw new IllegalStateException("store timeout");
            }
        };

        AbuseAssessment assessment = detector(broken, fixed(AbuseCheckResult.pass(AbuseCheckType.VELOCITY)))
                .assess(attempt);

        assertThat(assessment.isAllowed()).isTrue();
        verify(metricsConfig).recordAbuseCheckError("WALLET_VELOCITY");
    }

    @Test
    void assess_slowCheckTimesOutAsPass() {
        config.setCheckTimeoutMs(50);
        AbuseCheck slow = new AbuseCheck() {
            @Override
            public AbuseCheckType getCheckType() {
                return AbuseCheckType.CIRCULAR_TRANSFER;
            }

            @Override
            public AbuseCheckResult evaluate(TipAttempt a) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return AbuseCheckResult.reject(getCheckType(), Severity.HIGH, "late", Map.of());
            }
        };
        AbuseDetector detector = new AbuseDetector(List.of(slow), Executors.newCachedThreadPool(), config, metricsConfig);

        assertThat(detector.assess(attempt).isAllowed()).isTrue();
        verify(metricsConfig).recordAbuseCheckError("CIRCULAR_TRANSFER");
    }

    @Test
    void assess_saturatedExecutor_unscheduledChecksPass() {
        AtomicInteger submitted = new AtomicInteger();
        Executor saturatedAfterOne = task -> {
            if (submitted.incrementAndGet() > 1) {
                throw new TaskRejectedException("abuse-check pool full");
            }
            task.run();
        };
        AbuseDetector detector = new AbuseDetector(List.of(
                fixed(AbuseCheckResult.reject(AbuseCheckType.SELF_DEALING, Severity.CRITICAL, "Cannot tip yourself.", Map.of())),
                fixed(TestDataFactory.velocityRejection(30))),
                saturatedAfterOne, config, metricsConfig);

        AbuseAssessment assessment = detector.assess(attempt);

        assertThat(assessment.isAllowed()).isFalse();
        assertThat(assessment.getCheckType()).isEqualTo(AbuseCheckType.SELF_DEALING);
        assertThat(assessment.getResults()).hasSize(2);
        verify(metricsConfig).recordAbuseCheckError("VELOCITY");
    }

    @Test
    void assess_executorRejectsEverything_isAllowed() {
        Executor rejecting = task -> {
            throw new TaskRejectedException("abuse-check pool full");
        };
        AbuseDetector detector = new AbuseDetector(List.of(fixed(TestDataFactory.velocityRejection(30))),
                rejecting, config, metricsConfig);

        assertThat(detector.assess(attempt).isAllowed()).isTrue();
        verify(metricsConfig).recordAbuseCheckError("VELOCITY");
    }

    @Test
    void assess_disabled_skipsChecks() {
        config.setEnabled(false);
        AbuseCheck check = mock(AbuseCheck.class);
        when(check.getCheckType()).thenReturn(AbuseCheckType.VELOCITY);

        AbuseAssessment assessment = detector(check).assess(attempt);

        assertThat(assessment.isAllowed()).isTrue();
        verify(check, never()).evaluate(any());
    }

    @Test
    void clearUserSignals_reachesEveryCheck() {
        AbuseCheck first = mock(AbuseCheck.class);
        AbuseCheck second = mock(AbuseCheck.class);
        when(first.getCheckType()).thenReturn(AbuseCheckType.VELOCITY);
        when(second.getCheckType()).thenReturn(AbuseCheckType.FARMING);

        detector(first, second).clearUserSignals("alice");

        verify(first).clearSignals("alice");
        verify(second).clearSignals("alice");
    }

    private AbuseDetector detector(AbuseCheck... checks) {
        return new AbuseDetector(List.of(checks), Runnable::run, config, metricsConfig);
    }

    private static AbuseCheck fixed(AbuseCheckResult result) {
        return new AbuseCheck() {
            @Override
            public AbuseCheckType getCheckType() {
                return result.getCheckType();
            }

            @Override
            public AbuseCheckResult evaluate(TipAttempt a) {
                return result;
            }
        };
    }
}
