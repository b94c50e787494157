package com.social.tipping.engine;

import com.social.tipping.config.AbuseDetectionConfig;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.AbuseAssessment;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.AbuseCheckType;
import com.social.tipping.model.Severity;
import com.social.tipping.model.TipAttempt;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs every registered {@link AbuseCheck} against a tip attempt and combines the results.
 * Checks run concurrently; the most severe rejection decides the outcome.
 */
@Component
public class AbuseDetector {

    private static final Logger log = LoggerFactory.getLogger(AbuseDetector.class);

    private final List<AbuseCheck> checks;
    private final Executor executor;
    private final AbuseDetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AbuseDetector(List<AbuseCheck> checks,
                         @Qualifier("abuseCheckExecutor") Executor executor,
                         AbuseDetectionConfig config,
                         MetricsConfig metricsConfig) {
        this.checks = List.copyOf(checks);
        this.executor = executor;
        this.config = config;
        this.metricsConfig = metricsConfig;

        for (AbuseCheck check : checks) {
            log.info("Registered abuse check: {} -> {}", check.getCheckType(), check.getClass().getSimpleName());
        }
    }

    @Observed(name = "abuse.assess", contextualName = "assess-abuse")
    public AbuseAssessment assess(TipAttempt attempt) {
        if (!config.isEnabled()) {
            return AbuseAssessment.builder()
                    .allowed(true)
                    .severity(Severity.LOW)
                    .results(List.of())
                    .build();
        }

        List<CompletableFuture<AbuseCheckResult>> futures = new ArrayList<>(checks.size());
        for (AbuseCheck check : checks) {
            futures.add(run(check, attempt));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<AbuseCheckResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        Optional<AbuseCheckResult> worst = results.stream()
                .filter(r -> !r.isAllowed())
                .max(Comparator.comparing(AbuseCheckResult::getSeverity));

        List<AbuseCheckResult> flags = results.stream()
                .filter(r -> r.isAllowed() && r.isFlaggedForReview())
                .collect(Collectors.toList());
        String reviewReason = flags.isEmpty() ? null : flags.stream()
                .map(AbuseCheckResult::getReason)
                .collect(Collectors.joining("; "));

        if (worst.isPresent()) {
            AbuseCheckResult rejection = worst.get();
            metricsConfig.recordAbuseRejection(rejection.getCheckType().name(), rejection.getSeverity().name());
            if (rejection.getSeverity().isAtLeast(Severity.HIGH)) {
                log.warn("Abuse detected: sender={} recipient={} check={} severity={} reason={}",
                        attempt.getSenderId(), attempt.getRecipientId(), rejection.getCheckType(),
                        rejection.getSeverity(), rejection.getReason());
            } else {
                log.debug("Tip rejected by {}: sender={} reason={}",
                        rejection.getCheckType(), attempt.getSenderId(), rejection.getReason());
            }
            return AbuseAssessment.builder()
                    .allowed(false)
                    .reason(rejection.getReason())
                    .severity(rejection.getSeverity())
                    .checkType(rejection.getCheckType())
                    .flaggedForReview(!flags.isEmpty())
                    .reviewReason(reviewReason)
                    .results(results)
                    .build();
        }

        if (!flags.isEmpty()) {
            metricsConfig.recordAbuseFlagged();
            log.info("Tip flagged for review: sender={} recipient={} amount={} reason={}",
                    attempt.getSenderId(), attempt.getRecipientId(), attempt.getAmount(), reviewReason);
        }

        return AbuseAssessment.builder()
                .allowed(true)
                .severity(flags.isEmpty() ? Severity.LOW
                        : flags.stream().map(AbuseCheckResult::getSeverity).max(Comparator.naturalOrder()).get())
                .flaggedForReview(!flags.isEmpty())
                .reviewReason(reviewReason)
                .results(results)
                .build();
    }

    // A broken, slow or unschedulable check counts as a pass and must not block tipping.
    private CompletableFuture<AbuseCheckResult> run(AbuseCheck check, TipAttempt attempt) {
        CompletableFuture<AbuseCheckResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> check.evaluate(attempt), executor);
        } catch (RejectedExecutionException e) {
            log.error("Abuse check {} not scheduled for sender={}, executor saturated: {}",
                    check.getCheckType(), attempt.getSenderId(), e.getMessage());
            metricsConfig.recordAbuseCheckError(check.getCheckType().name());
            return CompletableFuture.completedFuture(AbuseCheckResult.pass(check.getCheckType()));
        }
        return future
                .orTimeout(config.getCheckTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.error("Abuse check {} failed for sender={}: {}",
                            check.getCheckType(), attempt.getSenderId(), e.getMessage(), e);
                    metricsConfig.recordAbuseCheckError(check.getCheckType().name());
                    return AbuseCheckResult.pass(check.getCheckType());
                });
    }

    /**
     * Delete every sender-scoped signal so the user starts from a clean slate.
     */
    public void clearUserSignals(String userId) {
        for (AbuseCheck check : checks) {
            check.clearSignals(userId);
        }
        log.info("Cleared abuse signals for user={}", userId);
    }

    public List<AbuseCheckType> registeredChecks() {
        return checks.stream().map(AbuseCheck::getCheckType).collect(Collectors.toList());
    }
}
