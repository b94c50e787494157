package com.social.tipping.service;

import com.social.tipping.client.SettlementClient;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.SettledTip;
import com.social.tipping.model.TipJob;
import com.social.tipping.resilience.CircuitBreaker;
import com.social.tipping.resilience.CircuitBreakers;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * The work done for one tip job: settle, update rankings, then fan out enrichment.
 * Only settlement can fail the job; the later steps are best effort.
 */
@Component
public class TipJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(TipJobProcessor.class);

    private final SettlementClient settlementClient;
    private final CircuitBreaker settlementBreaker;
    private final LeaderboardService leaderboardService;
    private final EnrichmentDispatcher enrichmentDispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TipJobProcessor(SettlementClient settlementClient,
                           CircuitBreakers breakers,
                           LeaderboardService leaderboardService,
                           EnrichmentDispatcher enrichmentDispatcher,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.settlementClient = settlementClient;
        this.settlementBreaker = breakers.get("settlement");
        this.leaderboardService = leaderboardService;
        this.enrichmentDispatcher = enrichmentDispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @return the settlement transaction handle
     */
    @Observed(name = "tip.process", contextualName = "process-tip-job")
    public String process(TipJob job) {
        // 1. Settle. Failures propagate and drive the retry policy.
        String handle = settlementBreaker.execute(() -> settlementClient.settle(
                job.getJobId(), job.getSenderId(), job.getRecipientId(),
                job.getAmount(), job.getContentReference()));
        long settledAt = clock.millis();

        // 2. Rankings. The transfer already happened, so a failure here must not fail the job.
        boolean firstCredit = true;
        try {
            firstCredit = leaderboardService.recordTip(job.getJobId(), job.getSenderId(), job.getRecipientId(),
                    job.getAmount(), handle, settledAt);
        } catch (Exception e) {
            metricsConfig.recordLeaderboardFailure();
            log.error("Leaderboard update failed for job {}: {}", job.getJobId(), e.getMessage(), e);
        }
        if (!firstCredit) {
            // redelivery of a job that was already processed; enrichment ran the first time
            metricsConfig.recordDuplicateCredit();
            log.info("Tip job {} redelivered after settlement, skipping enrichment", job.getJobId());
            return handle;
        }

        // 3. Enrichment, fire-and-forget.
        enrichmentDispatcher.dispatch(SettledTip.builder()
                .jobId(job.getJobId())
                .senderId(job.getSenderId())
                .recipientId(job.getRecipientId())
                .amount(job.getAmount())
                .contentReference(job.getContentReference())
                .transactionHandle(handle)
                .settledAt(settledAt)
                .build());

        return handle;
    }
}
