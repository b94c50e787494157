package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.config.TipQueueConfig;
import com.social.tipping.model.FailedTipJob;
import com.social.tipping.model.FailureKind;
import com.social.tipping.model.JobStatus;
import com.social.tipping.model.TipJob;
import com.social.tipping.repository.FailedJobRepository;
import com.social.tipping.repository.TipJobRepository;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Worker side of the tip queue: claims jobs, runs them through the processor and applies the
 * retry policy to failures.
 *
 * <p>The worker executor's pool size bounds concurrency; the dequeue {@link RateLimiter} caps the
 * start rate, and a job that finds no permit is handed back to the scheduler without holding a
 * worker. A job id is dispatched at most once at a time inside this process, and the claim in the
 * job record keeps other processes from running it concurrently.
 *
 * <p>Settlement failures drive the retry policy. Once settlement succeeded the job is never run
 * again because of a job-store error: only the completion write is retried.
 */
@Service
public class TipJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TipJobDispatcher.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final TipJobRepository jobRepository;
    private final FailedJobRepository failedJobRepository;
    private final TipJobProcessor processor;
    private final FailureClassifier failureClassifier;
    private final TaskExecutor workerExecutor;
    private final TaskScheduler retryScheduler;
    private final TipQueueConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final RetryBackoff backoff;
    private final RateLimiter dequeueRateLimiter;
    private final long throttledRedispatchMs;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public TipJobDispatcher(TipJobRepository jobRepository,
                            FailedJobRepository failedJobRepository,
                            TipJobProcessor processor,
                            FailureClassifier failureClassifier,
                            @Qualifier("tipWorkerExecutor") TaskExecutor workerExecutor,
                            @Qualifier("tipRetryScheduler") TaskScheduler retryScheduler,
                            TipQueueConfig config,
                            MetricsConfig metricsConfig,
                            @Qualifier("dequeueRateLimiter") RateLimiter dequeueRateLimiter,
                            Clock clock) {
        this.jobRepository = jobRepository;
        this.failedJobRepository = failedJobRepository;
        this.processor = processor;
        this.failureClassifier = failureClassifier;
        this.workerExecutor = workerExecutor;
        this.retryScheduler = retryScheduler;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.backoff = new RetryBackoff(config.getBackoffBaseMs(), config.getMaxAttempts());
        this.dequeueRateLimiter = dequeueRateLimiter;
        this.throttledRedispatchMs = dequeueRateLimiter.getRateLimiterConfig().getLimitRefreshPeriod().toMillis();
    }

    /**
     * Hand a job to the worker pool.
     *
     * @return false when the job is already running here or the pool refused it
     */
    public boolean dispatch(String jobId) {
        if (!inFlight.add(jobId)) {
            log.debug("Job {} already in flight, skipping dispatch", jobId);
            return false;
        }
        metricsConfig.updateInFlightJobs(inFlight.size());
        try {
            workerExecutor.execute(() -> run(jobId));
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(jobId);
            metricsConfig.updateInFlightJobs(inFlight.size());
            // The record stays WAITING; the stalled-job monitor picks it up again.
            log.warn("Worker pool rejected job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    void run(String jobId) {
        Long nextDispatchAt = null;
        try {
            if (!dequeueRateLimiter.acquirePermission()) {
                metricsConfig.recordDequeueThrottled();
                log.debug("Dequeue rate reached, deferring job {} by {}ms", jobId, throttledRedispatchMs);
                nextDispatchAt = clock.millis() + throttledRedispatchMs;
            } else {
                TipJob job = jobRepository.claim(jobId, clock.millis(), config.getLockDurationMs());
                if (job != null) {
                    nextDispatchAt = process(job);
                }
            }
        } finally {
            inFlight.remove(jobId);
            metricsConfig.updateInFlightJobs(inFlight.size());
        }

        if (nextDispatchAt != null) {
            retryScheduler.schedule(() -> dispatch(jobId), Instant.ofEpochMilli(nextDispatchAt));
        }
    }

    /**
     * @return epoch millis of the next attempt, or null when the job needs no further dispatch
     */
    private Long process(TipJob job) {
        String handle;
        try {
            handle = processor.process(job);
        } catch (Exception e) {
            return handleFailure(job, e);
        }
        job.setStatus(JobStatus.COMPLETED);
        job.setTransactionHandle(handle);
        job.setCompletedAt(clock.millis());
        job.setLastError(null);
        recordCompletion(job, 1);
        return null;
    }

    /**
     * Write the completed job. A store error here is retried on the scheduler without running the
     * job again; the settlement already happened.
     */
    void recordCompletion(TipJob job, int writeAttempt) {
        try {
            if (jobRepository.saveTerminal(job, config.getCompletedRetentionSeconds())) {
                metricsConfig.recordJobCompleted();
                log.info("Tip job {} completed on attempt {}: handle={}",
                        job.getJobId(), job.getAttemptCount(), job.getTransactionHandle());
                return;
            }
            TipJob current = jobRepository.findById(job.getJobId());
            if (current != null && current.getStatus() == JobStatus.COMPLETED) {
                // an earlier write that reported an error did land
                metricsConfig.recordJobCompleted();
                log.info("Tip job {} completion already recorded: handle={}",
                        job.getJobId(), current.getTransactionHandle());
            } else {
                log.warn("Tip job {} settled (handle={}) but its record was taken over; completion left to the new owner",
                        job.getJobId(), job.getTransactionHandle());
            }
        } catch (Exception e) {
            metricsConfig.recordJobStoreFailure();
            if (writeAttempt < backoff.getMaxAttempts()) {
                long delay = backoff.delayMs(writeAttempt);
                log.error("Tip job {} settled (handle={}) but the completion write failed, retrying write in {}ms: {}",
                        job.getJobId(), job.getTransactionHandle(), delay, e.getMessage());
                retryScheduler.schedule(() -> recordCompletion(job, writeAttempt + 1),
                        Instant.ofEpochMilli(clock.millis() + delay));
            } else {
                log.error("Tip job {} settled (handle={}) but the completion write failed {} times; "
                                + "a redelivery will settle idempotently and skip leaderboard credit",
                        job.getJobId(), job.getTransactionHandle(), writeAttempt, e);
            }
        }
    }

    private Long handleFailure(TipJob job, Exception error) {
        FailureKind kind = failureClassifier.classify(error);
        long now = clock.millis();
        job.setLastError(truncate(error.getMessage()));

        if (kind == FailureKind.TRANSIENT && backoff.hasAttemptsLeft(job.getAttemptCount())) {
            long delay = backoff.delayMs(job.getAttemptCount());
            job.setStatus(JobStatus.DELAYED);
            job.setAvailableAt(now + delay);
            job.setLockedUntil(0);
            if (!jobRepository.save(job)) {
                log.warn("Tip job {} was taken over before its retry could be scheduled", job.getJobId());
                return null;
            }
            metricsConfig.recordJobRetry();
            log.warn("Tip job {} failed on attempt {}/{}, retrying in {}ms: {}",
                    job.getJobId(), job.getAttemptCount(), backoff.getMaxAttempts(), delay, error.getMessage());
            return job.getAvailableAt();
        }

        job.setStatus(JobStatus.FAILED);
        job.setLockedUntil(0);
        if (!jobRepository.saveTerminal(job, config.getFailedRetentionSeconds())) {
            log.warn("Tip job {} was taken over before it could be marked failed", job.getJobId());
            return null;
        }
        failedJobRepository.save(FailedTipJob.builder()
                .jobId(job.getJobId())
                .job(job)
                .error(job.getLastError())
                .failureKind(kind)
                .attempts(job.getAttemptCount())
                .failedAt(now)
                .build(), config.getFailedRetentionSeconds());
        metricsConfig.recordJobFailed(kind.name());
        log.error("Tip job {} failed permanently after {} attempt(s) ({}): {}",
                job.getJobId(), job.getAttemptCount(), kind, error.getMessage(), error);
        return null;
    }

    private static String truncate(String message) {
        if (message == null) return "unknown error";
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
