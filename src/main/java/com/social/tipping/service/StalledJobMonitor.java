package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.JobStatus;
import com.social.tipping.model.TipJob;
import com.social.tipping.repository.TipJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Periodic sweep that keeps the queue moving: jobs whose worker died (expired lock) and due
 * jobs nobody is running, e.g. after a restart, are dispatched again.
 */
@Service
public class StalledJobMonitor {

    private static final Logger log = LoggerFactory.getLogger(StalledJobMonitor.class);

    private final TipJobRepository jobRepository;
    private final TipJobDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public StalledJobMonitor(TipJobRepository jobRepository, TipJobDispatcher dispatcher,
                             MetricsConfig metricsConfig, Clock clock) {
        this.jobRepository = jobRepository;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tip-queue.stall-check-interval-ms:5000}",
               initialDelayString = "${tip-queue.stall-check-interval-ms:5000}")
    public void sweep() {
        List<TipJob> pending;
        try {
            pending = jobRepository.findPending();
        } catch (Exception e) {
            log.warn("Stalled job sweep skipped, job store unavailable: {}", e.getMessage());
            return;
        }

        long now = clock.millis();
        int stalled = 0;
        int redispatched = 0;

        for (TipJob job : pending) {
            if (dispatcher.isInFlight(job.getJobId())) {
                continue;
            }
            if (job.getStatus() == JobStatus.ACTIVE) {
                if (job.getLockedUntil() < now) {
                    stalled++;
                    metricsConfig.recordJobStalled();
                    log.warn("Tip job {} stalled on attempt {}; lock expired {}ms ago, re-queuing",
                            job.getJobId(), job.getAttemptCount(), now - job.getLockedUntil());
                    dispatcher.dispatch(job.getJobId());
                }
            } else if (job.getAvailableAt() <= now) {
                if (dispatcher.dispatch(job.getJobId())) {
                    redispatched++;
                }
            }
        }

        if (stalled > 0 || redispatched > 0) {
            log.info("Queue sweep: {} stalled job(s) re-queued, {} due job(s) dispatched", stalled, redispatched);
        }
    }
}
