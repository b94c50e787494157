package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.FailedTipJob;
import com.social.tipping.model.JobStatus;
import com.social.tipping.model.QueueStats;
import com.social.tipping.model.TipJob;
import com.social.tipping.repository.FailedJobRepository;
import com.social.tipping.repository.TipJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Producer side of the tip queue plus its admin operations.
 */
@Service
public class TipJobQueue {

    private static final Logger log = LoggerFactory.getLogger(TipJobQueue.class);

    private final TipJobRepository jobRepository;
    private final FailedJobRepository failedJobRepository;
    private final TipJobDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TipJobQueue(TipJobRepository jobRepository,
                       FailedJobRepository failedJobRepository,
                       TipJobDispatcher dispatcher,
                       MetricsConfig metricsConfig,
                       Clock clock) {
        this.jobRepository = jobRepository;
        this.failedJobRepository = failedJobRepository;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Persist the job and hand it to the workers. The id is derived from sender, recipient and
     * {@code createdAt}; a second enqueue with the same id keeps the first record and returns its id.
     */
    public String enqueue(TipJob job) {
        if (job.getCreatedAt() == 0) {
            job.setCreatedAt(clock.millis());
        }
        String jobId = TipJob.buildJobId(job.getSenderId(), job.getRecipientId(), job.getCreatedAt());
        job.setJobId(jobId);
        job.setStatus(JobStatus.WAITING);
        job.setAttemptCount(0);
        job.setAvailableAt(job.getCreatedAt());
        job.setLockedUntil(0);

        if (!jobRepository.create(job)) {
            metricsConfig.recordDuplicateEnqueue();
            log.warn("Duplicate tip job {} ignored; keeping the existing record", jobId);
            return jobId;
        }

        metricsConfig.recordJobEnqueued();
        log.info("Enqueued tip job {}: sender={} recipient={} amount={}",
                jobId, job.getSenderId(), job.getRecipientId(), job.getAmount());
        dispatcher.dispatch(jobId);
        return jobId;
    }

    public TipJob getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    public QueueStats getStats() {
        Map<JobStatus, Long> counts = jobRepository.countByStatus();
        long waiting = counts.getOrDefault(JobStatus.WAITING, 0L);
        metricsConfig.updateWaitingJobs((int) Math.min(Integer.MAX_VALUE, waiting));
        return new QueueStats(
                waiting,
                counts.getOrDefault(JobStatus.ACTIVE, 0L),
                counts.getOrDefault(JobStatus.DELAYED, 0L),
                counts.getOrDefault(JobStatus.COMPLETED, 0L),
                counts.getOrDefault(JobStatus.FAILED, 0L),
                dispatcher.inFlightCount());
    }

    public List<FailedTipJob> getFailedJobs(int limit) {
        return failedJobRepository.findAll(Math.max(1, Math.min(limit, 500)));
    }

    /**
     * Put a dead-lettered job back on the queue with a fresh attempt budget.
     *
     * @return the re-queued job, or null when no dead letter exists for the id
     */
    public TipJob retryFailed(String jobId) {
        FailedTipJob failed = failedJobRepository.findById(jobId);
        if (failed == null) {
            return null;
        }
        TipJob job = failed.getJob();
        job.setStatus(JobStatus.WAITING);
        job.setAttemptCount(0);
        job.setAvailableAt(clock.millis());
        job.setLockedUntil(0);
        job.setLastError(null);
        jobRepository.save(job);
        failedJobRepository.delete(jobId);

        log.info("Dead-lettered job {} re-queued after {} failed attempt(s)", jobId, failed.getAttempts());
        dispatcher.dispatch(jobId);
        return job;
    }
}
