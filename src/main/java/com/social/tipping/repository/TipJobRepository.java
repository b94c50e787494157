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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.model.JobStatus;
import com.social.tipping.model.ModerationVerdict;
import com.social.tipping.model.TipJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable job records. Pending jobs never expire; terminal jobs get a retention TTL.
 */
@Repository
public class TipJobRepository {

    private static final Logger log = LoggerFactory.getLogger(TipJobRepository.class);

    private static final int NEVER_EXPIRE = -1;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public TipJobRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Insert a new job. Returns false when a job with the same id already exists.
     */
    public boolean create(TipJob job) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.expiration = NEVER_EXPIRE;
        try {
            client.put(policy, key(job.getJobId()), toBins(job));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Write back a job read or claimed earlier. The write only lands if the record is still at the
     * generation the job was read at.
     *
     * @return false when another writer changed the record in between
     */
    public boolean save(TipJob job) {
        int expiration = job.getStatus().isTerminal() ? writePolicy.expiration : NEVER_EXPIRE;
        return guardedPut(job, expiration);
    }

    /**
     * Persist a terminal job with its retention period, guarded like {@link #save}.
     *
     * @return false when another writer changed the record in between
     */
    public boolean saveTerminal(TipJob job, int retentionSeconds) {
        return guardedPut(job, retentionSeconds);
    }

    public TipJob findById(String jobId) {
        Record record = client.get(readPolicy, key(jobId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Take the job for processing: WAITING, DELAYED or lock-expired ACTIVE jobs become ACTIVE with
     * a fresh lock and one more attempt. The write is guarded by the record generation, so only one
     * claimant wins.
     *
     * @return the claimed job, or null when it is missing, terminal, locked or lost to a racer
     */
    public TipJob claim(String jobId, long now, long lockDurationMs) {
        Record record = client.get(readPolicy, key(jobId));
        if (record == null) return null;

        TipJob job = mapRecord(record);
        boolean claimable = job.getStatus() == JobStatus.WAITING
                || job.getStatus() == JobStatus.DELAYED
                || (job.getStatus() == JobStatus.ACTIVE && job.getLockedUntil() < now);
        if (!claimable) {
            log.debug("Job {} not claimable in status {}", jobId, job.getStatus());
            return null;
        }

        job.setStatus(JobStatus.ACTIVE);
        job.setAttemptCount(job.getAttemptCount() + 1);
        job.setLockedUntil(now + lockDurationMs);

        if (!guardedPut(job, NEVER_EXPIRE)) {
            log.debug("Lost claim race for job {}", jobId);
            return null;
        }
        return job;
    }

    public List<TipJob> findByStatuses(Set<JobStatus> statuses) {
        List<TipJob> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TIP_JOBS,
                (key, record) -> {
                    try {
                        JobStatus status = JobStatus.valueOf(record.getString("status"));
                        if (statuses.contains(status)) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read tip job record: {}", e.getMessage());
                    }
                });
        return results;
    }

    public List<TipJob> findPending() {
        return findByStatuses(EnumSet.of(JobStatus.WAITING, JobStatus.DELAYED, JobStatus.ACTIVE));
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TIP_JOBS,
                (key, record) -> {
                    String status = record.getString("status");
                    if (status != null) {
                        synchronized (counts) {
                            counts.merge(JobStatus.valueOf(status), 1L, Long::sum);
                        }
                    }
                }, "status");
        return counts;
    }

    /**
     * Put with {@code EXPECT_GEN_EQUAL} on the job's generation; on success the job carries the new
     * generation. A job that was never read (generation 0) is written unconditionally.
     */
    private boolean guardedPut(TipJob job, int expiration) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = expiration;
        if (job.getGeneration() > 0) {
            policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            policy.generation = job.getGeneration();
        }
        try {
            client.put(policy, key(job.getJobId()), toBins(job));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                return false;
            }
            throw e;
        }
        job.setGeneration(job.getGeneration() + 1);
        return true;
    }

    private Key key(String jobId) {
        return new Key(namespace, AerospikeConfig.SET_TIP_JOBS, jobId);
    }

    private Bin[] toBins(TipJob job) {
        return new Bin[]{
                new Bin("jobId", job.getJobId()),
                new Bin("senderId", job.getSenderId()),
                new Bin("recipientId", job.getRecipientId()),
                new Bin("amount", Long.toString(job.getAmount())),
                new Bin("contentRef", job.getContentReference() != null ? job.getContentReference() : ""),
                new Bin("moderation", serializeVerdict(job.getModerationVerdict())),
                new Bin("createdAt", job.getCreatedAt()),
                new Bin("attempts", job.getAttemptCount()),
                new Bin("status", job.getStatus().name()),
                new Bin("availableAt", job.getAvailableAt()),
                new Bin("lockedUntil", job.getLockedUntil()),
                new Bin("lastError", job.getLastError() != null ? job.getLastError() : ""),
                new Bin("txHandle", job.getTransactionHandle() != null ? job.getTransactionHandle() : ""),
                new Bin("flagged", job.isFlaggedForReview() ? 1 : 0),
                new Bin("completedAt", job.getCompletedAt())
        };
    }

    private TipJob mapRecord(Record record) {
        return TipJob.builder()
                .jobId(record.getString("jobId"))
                .senderId(record.getString("senderId"))
                .recipientId(record.getString("recipientId"))
                .amount(Long.parseLong(record.getString("amount")))
                .contentReference(emptyToNull(record.getString("contentRef")))
                .moderationVerdict(deserializeVerdict(record.getString("moderation")))
                .createdAt(record.getLong("createdAt"))
                .attemptCount(record.getInt("attempts"))
                .status(JobStatus.valueOf(record.getString("status")))
                .availableAt(record.getLong("availableAt"))
                .lockedUntil(record.getLong("lockedUntil"))
                .lastError(emptyToNull(record.getString("lastError")))
                .transactionHandle(emptyToNull(record.getString("txHandle")))
                .flaggedForReview(record.getInt("flagged") == 1)
                .completedAt(record.getLong("completedAt"))
                .generation(record.generation)
                .build();
    }

    private String serializeVerdict(ModerationVerdict verdict) {
        if (verdict == null) return "";
        try {
            return objectMapper.writeValueAsString(verdict);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize moderation verdict: {}", e.getMessage());
            return "";
        }
    }

    private ModerationVerdict deserializeVerdict(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, ModerationVerdict.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize moderation verdict: {}", e.getMessage());
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
