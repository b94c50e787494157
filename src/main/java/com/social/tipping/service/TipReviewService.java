package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.PagedResponse;
import com.social.tipping.model.ReviewStatus;
import com.social.tipping.model.TipAttempt;
import com.social.tipping.model.TipReviewItem;
import com.social.tipping.repository.TipReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator queue for tips that were accepted but flagged as unusual.
 */
@Service
public class TipReviewService {

    private static final Logger log = LoggerFactory.getLogger(TipReviewService.class);

    private final TipReviewRepository reviewRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TipReviewService(TipReviewRepository reviewRepository, MetricsConfig metricsConfig, Clock clock) {
        this.reviewRepository = reviewRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Add a flagged tip to the queue. Failures are logged only: the tip is already queued.
     */
    public void enqueue(String jobId, TipAttempt attempt, String reason) {
        TipReviewItem item = TipReviewItem.builder()
                .jobId(jobId)
                .senderId(attempt.getSenderId())
                .recipientId(attempt.getRecipientId())
                .amount(attempt.getAmount())
                .reason(reason)
                .enqueuedAt(clock.millis())
                .status(ReviewStatus.PENDING)
                .build();
        try {
            if (reviewRepository.create(item)) {
                log.info("Tip {} queued for review: {}", jobId, reason);
            }
        } catch (Exception e) {
            log.error("Failed to queue tip {} for review: {}", jobId, e.getMessage(), e);
        }
    }

    public PagedResponse<TipReviewItem> getQueueItems(ReviewStatus status, String senderId, int limit, Long before) {
        return reviewRepository.findByFilters(status, senderId, Math.max(1, Math.min(limit, 200)), before);
    }

    public TipReviewItem getItem(String jobId) {
        return reviewRepository.findByJobId(jobId);
    }

    /**
     * @return the item after the attempt, or null when it does not exist
     */
    public TipReviewItem resolve(String jobId, ReviewStatus status, String reviewedBy) {
        if (status != ReviewStatus.CLEARED && status != ReviewStatus.CONFIRMED_ABUSE) {
            throw new IllegalArgumentException("Resolution must be CLEARED or CONFIRMED_ABUSE");
        }

        boolean updated = reviewRepository.resolve(jobId, status, reviewedBy, clock.millis());
        if (!updated) {
            log.warn("Could not resolve review item {}: not found or already resolved", jobId);
        } else {
            metricsConfig.recordReviewResolved(status.name());
            log.info("Review item {} resolved as {} by {}", jobId, status, reviewedBy);
        }
        return reviewRepository.findByJobId(jobId);
    }

    public Map<String, Integer> getStats() {
        Map<ReviewStatus, Integer> counts = reviewRepository.countByStatus();
        Map<String, Integer> stats = new LinkedHashMap<>();
        int total = 0;
        for (ReviewStatus status : ReviewStatus.values()) {
            int count = counts.getOrDefault(status, 0);
            stats.put(status.name().toLowerCase(), count);
            total += count;
        }
        stats.put("total", total);
        return stats;
    }
}
