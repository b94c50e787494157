package com.social.tipping.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger inFlightJobs;
    private final AtomicInteger waitingJobs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.inFlightJobs = registry.gauge("job.inflight", new AtomicInteger(0));
        this.waitingJobs = registry.gauge("job.queue.depth", new AtomicInteger(0));
    }

    public void recordSubmission(String outcome) {
        Counter.builder("tip.submission.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRateLimitCheck(String scope, boolean allowed) {
        Counter.builder("ratelimit.check.count")
                .tag("scope", scope)
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }

    public void recordRateLimitFailOpen(String scope) {
        Counter.builder("ratelimit.failopen.count")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public void recordAbuseRejection(String check, String severity) {
        Counter.builder("abuse.rejection.count")
                .tag("check", check)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAbuseFlagged() {
        Counter.builder("abuse.flagged.count")
                .register(registry)
                .increment();
    }

    public void recordAbuseCheckError(String check) {
        Counter.builder("abuse.check.error.count")
                .tag("check", check)
                .register(registry)
                .increment();
    }

    public void recordJobEnqueued() {
        Counter.builder("job.enqueued.count")
                .register(registry)
                .increment();
    }

    public void recordDuplicateEnqueue() {
        Counter.builder("job.duplicate.count")
                .register(registry)
                .increment();
    }

    public void recordJobCompleted() {
        Counter.builder("job.completed.count")
                .register(registry)
                .increment();
    }

    public void recordJobRetry() {
        Counter.builder("job.retry.count")
                .register(registry)
                .increment();
    }

    public void recordJobFailed(String kind) {
        Counter.builder("job.failed.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordJobStalled() {
        Counter.builder("job.stalled.count")
                .register(registry)
                .increment();
    }

    public void recordJobStoreFailure() {
        Counter.builder("job.store.failure.count")
                .register(registry)
                .increment();
    }

    public void recordDequeueThrottled() {
        Counter.builder("job.dequeue.throttled.count")
                .register(registry)
                .increment();
    }

    public void recordDuplicateCredit() {
        Counter.builder("leaderboard.duplicate.skipped.count")
                .register(registry)
                .increment();
    }

    public void recordLeaderboardFailure() {
        Counter.builder("leaderboard.update.failure.count")
                .register(registry)
                .increment();
    }

    public void recordLedgerFailure() {
        Counter.builder("ledger.write.failure.count")
                .register(registry)
                .increment();
    }

    public void recordEnrichmentFailure(String enrichment) {
        Counter.builder("enrichment.failure.count")
                .tag("enrichment", enrichment)
                .register(registry)
                .increment();
    }

    public void recordBreakerTransition(String name, String state) {
        Counter.builder("circuit.breaker.transition.count")
                .tag("name", name)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAchievementAwarded(String milestone) {
        Counter.builder("achievement.awarded.count")
                .tag("milestone", milestone)
                .register(registry)
                .increment();
    }

    public void recordReviewResolved(String status) {
        Counter.builder("review.resolved.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateInFlightJobs(int count) {
        inFlightJobs.set(count);
    }

    public void updateWaitingJobs(int count) {
        waitingJobs.set(count);
    }
}
