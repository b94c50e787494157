package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.SettledTip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs every {@link TipEnrichment} on a bounded executor. When the executor is saturated the
 * enrichment is dropped and counted rather than slowing down the worker.
 */
@Component
public class EnrichmentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentDispatcher.class);

    private final List<TipEnrichment> enrichments;
    private final TaskExecutor executor;
    private final MetricsConfig metricsConfig;

    public EnrichmentDispatcher(List<TipEnrichment> enrichments,
                                @Qualifier("enrichmentExecutor") TaskExecutor executor,
                                MetricsConfig metricsConfig) {
        this.enrichments = List.copyOf(enrichments);
        this.executor = executor;
        this.metricsConfig = metricsConfig;
    }

    public void dispatch(SettledTip tip) {
        for (TipEnrichment enrichment : enrichments) {
            try {
                executor.execute(() -> runSafely(enrichment, tip));
            } catch (TaskRejectedException e) {
                metricsConfig.recordEnrichmentFailure(enrichment.getName());
                log.warn("Enrichment {} dropped for job {}: executor saturated",
                        enrichment.getName(), tip.getJobId());
            }
        }
    }

    private void runSafely(TipEnrichment enrichment, SettledTip tip) {
        try {
            enrichment.onTipSettled(tip);
        } catch (Exception e) {
            metricsConfig.recordEnrichmentFailure(enrichment.getName());
            log.error("Enrichment {} failed for job {}: {}",
                    enrichment.getName(), tip.getJobId(), e.getMessage(), e);
        }
    }
}
