package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.model.PagedResponse;
import com.social.tipping.model.ReviewStatus;
import com.social.tipping.model.TipReviewItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class TipReviewRepository {

    private static final Logger log = LoggerFactory.getLogger(TipReviewRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public TipReviewRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * @return false when an item for the job already exists
     */
    public boolean create(TipReviewItem item) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, key(item.getJobId()),
                    new Bin("jobId", item.getJobId()),
                    new Bin("senderId", item.getSenderId()),
                    new Bin("recipientId", item.getRecipientId()),
                    new Bin("amount", item.getAmount()),
                    new Bin("reason", item.getReason()),
                    new Bin("enqueuedAt", item.getEnqueuedAt()),
                    new Bin("status", item.getStatus().name()),
                    new Bin("reviewedBy", ""),
                    new Bin("reviewedAt", 0L));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public TipReviewItem findByJobId(String jobId) {
        Record record = client.get(readPolicy, key(jobId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public PagedResponse<TipReviewItem> findByFilters(ReviewStatus status, String senderId, int limit, Long before) {
        List<TipReviewItem> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TIP_REVIEWS,
                (key, record) -> {
                    try {
                        if (status != null && !status.name().equals(record.getString("status"))) return;
                        if (senderId != null && !senderId.isEmpty()
                                && !senderId.equals(record.getString("senderId"))) return;
                        if (before != null && record.getLong("enqueuedAt") >= before) return;

                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter review record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(TipReviewItem::getEnqueuedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<TipReviewItem> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getEnqueuedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    /**
     * Resolve a PENDING item. The write is conditioned on the generation read, so two operators
     * resolving the same item cannot both win.
     *
     * @return true if this call resolved the item
     */
    public boolean resolve(String jobId, ReviewStatus status, String reviewedBy, long reviewedAt) {
        Key key = key(jobId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String current = record.getString("status");
        if (!ReviewStatus.PENDING.name().equals(current)) {
            log.debug("Review item {} already resolved as {}", jobId, current);
            return false;
        }

        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = record.generation;
        try {
            client.put(policy, key,
                    new Bin("status", status.name()),
                    new Bin("reviewedBy", reviewedBy),
                    new Bin("reviewedAt", reviewedAt));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public Map<ReviewStatus, Integer> countByStatus() {
        Map<ReviewStatus, Integer> counts = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus s : ReviewStatus.values()) {
            counts.put(s, 0);
        }
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TIP_REVIEWS,
                (key, record) -> {
                    try {
                        ReviewStatus s = ReviewStatus.valueOf(record.getString("status"));
                        synchronized (counts) {
                            counts.merge(s, 1, Integer::sum);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count review record: {}", e.getMessage());
                    }
                });
        return counts;
    }

    private Key key(String jobId) {
        return new Key(namespace, AerospikeConfig.SET_TIP_REVIEWS, jobId);
    }

    private TipReviewItem mapRecord(Record record) {
        String reviewedBy = record.getString("reviewedBy");
        return TipReviewItem.builder()
                .jobId(record.getString("jobId"))
                .senderId(record.getString("senderId"))
                .recipientId(record.getString("recipientId"))
                .amount(record.getLong("amount"))
                .reason(record.getString("reason"))
                .enqueuedAt(record.getLong("enqueuedAt"))
                .status(ReviewStatus.valueOf(record.getString("status")))
                .reviewedBy(reviewedBy != null && !reviewedBy.isEmpty() ? reviewedBy : null)
                .reviewedAt(record.getLong("reviewedAt"))
                .build();
    }
}
