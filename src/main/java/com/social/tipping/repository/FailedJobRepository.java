package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.exception.TipPipelineException;
import com.social.tipping.model.FailedTipJob;
import com.social.tipping.model.FailureKind;
import com.social.tipping.model.TipJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dead-letter store for jobs that exhausted their attempts or failed permanently.
 */
@Repository
public class FailedJobRepository {

    private static final Logger log = LoggerFactory.getLogger(FailedJobRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public FailedJobRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(FailedTipJob failed, int retentionSeconds) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = retentionSeconds;
        client.put(policy, key(failed.getJobId()),
                new Bin("jobId", failed.getJobId()),
                new Bin("job", serialize(failed.getJob())),
                new Bin("error", failed.getError() != null ? failed.getError() : ""),
                new Bin("kind", failed.getFailureKind().name()),
                new Bin("attempts", failed.getAttempts()),
                new Bin("failedAt", failed.getFailedAt()));
    }

    public FailedTipJob findById(String jobId) {
        Record record = client.get(readPolicy, key(jobId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Newest failures first.
     */
    public List<FailedTipJob> findAll(int limit) {
        List<FailedTipJob> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TIP_JOBS_DLQ,
                (key, record) -> {
                    try {
                        FailedTipJob failed = mapRecord(record);
                        synchronized (results) {
                            results.add(failed);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read dead-letter record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(FailedTipJob::getFailedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public boolean delete(String jobId) {
        return client.delete(writePolicy, key(jobId));
    }

    private Key key(String jobId) {
        return new Key(namespace, AerospikeConfig.SET_TIP_JOBS_DLQ, jobId);
    }

    private FailedTipJob mapRecord(Record record) {
        String error = record.getString("error");
        return FailedTipJob.builder()
                .jobId(record.getString("jobId"))
                .job(deserialize(record.getString("job")))
                .error(error == null || error.isEmpty() ? null : error)
                .failureKind(FailureKind.valueOf(record.getString("kind")))
                .attempts(record.getInt("attempts"))
                .failedAt(record.getLong("failedAt"))
                .build();
    }

    private String serialize(TipJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new TipPipelineException("Cannot serialize dead-letter job " + job.getJobId(), e);
        }
    }

    private TipJob deserialize(String json) {
        try {
            return objectMapper.readValue(json, TipJob.class);
        } catch (JsonProcessingException e) {
            throw new TipPipelineException("Corrupt dead-letter record", e);
        }
    }
}
