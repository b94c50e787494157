package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.BatchRecord;
import com.aerospike.client.BatchWrite;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.MapOperation;
import com.aerospike.client.cdt.MapOrder;
import com.aerospike.client.cdt.MapPolicy;
import com.aerospike.client.cdt.MapReturnType;
import com.aerospike.client.cdt.MapWriteFlags;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.BatchWritePolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.config.LeaderboardConfig;
import com.social.tipping.exception.TipPipelineException;
import com.social.tipping.model.LeaderboardEntry;
import com.social.tipping.model.TipTally;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Score boards are single records holding a {@code subjectId -> score} map, which keeps every
 * increment atomic and lets the server rank by value.
 */
@Repository
public class LeaderboardRepository {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardRepository.class);

    public static final String ALL_TIME = "all";

    private static final String SCORES_BIN = "scores";
    private static final MapPolicy SCORE_MAP = new MapPolicy(MapOrder.KEY_ORDERED, MapWriteFlags.DEFAULT);
    private static final int NEVER_EXPIRE = -1;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;
    private final LeaderboardConfig config;

    public LeaderboardRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy,
                                 @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy,
                                 LeaderboardConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.batchPolicy = batchPolicy;
        this.config = config;
    }

    /**
     * Apply every increment of one settled tip in a single batch round trip, at most once per job.
     *
     * <p>A create-only credit marker keyed by job id is written first. Batch records are applied
     * independently, so the marker cannot ride inside the batch as a condition; a redelivered job
     * finds the marker and its increments are skipped. When the batch applies nothing the marker is
     * removed again so a later delivery can credit the tip.
     *
     * @return false when the job was already credited
     * @throws TipPipelineException if any record of the batch was not written
     */
    public boolean applyTip(TipTally tally) {
        if (!markCredited(tally.getJobId())) {
            return false;
        }

        BatchWritePolicy allTime = new BatchWritePolicy();
        allTime.expiration = NEVER_EXPIRE;
        BatchWritePolicy weekly = new BatchWritePolicy();
        weekly.expiration = config.getWeeklyTtlSeconds();

        Value amount = Value.get(tally.getAmount());
        Value sender = Value.get(tally.getSenderId());
        Value recipient = Value.get(tally.getRecipientId());

        List<BatchRecord> records = new ArrayList<>(7);
        records.add(new BatchWrite(allTime, boardKey("senders", ALL_TIME),
                ops(MapOperation.increment(SCORE_MAP, SCORES_BIN, sender, amount))));
        records.add(new BatchWrite(weekly, boardKey("senders", tally.getWeekKey()),
                ops(MapOperation.increment(SCORE_MAP, SCORES_BIN, sender, amount))));
        records.add(new BatchWrite(allTime, boardKey("recipients", ALL_TIME),
                ops(MapOperation.increment(SCORE_MAP, SCORES_BIN, recipient, amount))));
        records.add(new BatchWrite(weekly, boardKey("recipients", tally.getWeekKey()),
                ops(MapOperation.increment(SCORE_MAP, SCORES_BIN, recipient, amount))));
        records.add(new BatchWrite(allTime, statsKey(tally.getSenderId()),
                ops(Operation.add(new Bin("tipsSent", 1L)),
                        Operation.add(new Bin("amountSent", tally.getAmount())))));
        records.add(new BatchWrite(allTime, statsKey(tally.getRecipientId()),
                ops(Operation.add(new Bin("tipsReceived", 1L)),
                        Operation.add(new Bin("amountReceived", tally.getAmount())))));
        records.add(new BatchWrite(weekly, weeklyStatsKey(tally.getSenderId(), tally.getWeekKey()),
                ops(Operation.add(new Bin("weeklyTips", 1L)),
                        Operation.add(new Bin("weeklyAmount", tally.getAmount())))));

        boolean allOk;
        try {
            allOk = client.operate(batchPolicy, records);
        } catch (AerospikeException e) {
            releaseCredit(tally.getJobId());
            throw e;
        }
        if (allOk) {
            return true;
        }

        List<String> failed = new ArrayList<>();
        for (BatchRecord record : records) {
            if (record.resultCode != ResultCode.OK) {
                failed.add(record.key.userKey + "=" + ResultCode.getResultString(record.resultCode));
            }
        }
        if (failed.size() == records.size()) {
            releaseCredit(tally.getJobId());
            throw new TipPipelineException("Leaderboard batch not applied: " + failed);
        }
        // Some increments landed; the marker stays so a redelivery cannot double them.
        throw new TipPipelineException("Leaderboard batch partially applied: " + failed);
    }

    private boolean markCredited(String jobId) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.expiration = config.getCreditMarkerTtlSeconds();
        try {
            client.put(policy, creditKey(jobId), new Bin("jobId", jobId));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.info("Tip job {} already credited to leaderboards, skipping increments", jobId);
                return false;
            }
            throw e;
        }
    }

    private void releaseCredit(String jobId) {
        try {
            client.delete(writePolicy, creditKey(jobId));
        } catch (AerospikeException e) {
            log.error("Could not release credit marker of job {}; its increments will not be retried: {}",
                    jobId, e.getMessage());
        }
    }

    /**
     * Highest scores first. Equal scores are ordered by subject id descending, the order the
     * server's reverse rank uses, so positions here agree with {@link #findRank}.
     */
    public List<LeaderboardEntry> findTop(String category, String periodKey, int limit) {
        Record record = client.operate(writePolicy, boardKey(category, periodKey),
                MapOperation.getByRankRange(SCORES_BIN, -limit, limit, MapReturnType.KEY_VALUE));
        if (record == null) return List.of();

        List<?> raw = record.getList(SCORES_BIN);
        if (raw == null) return List.of();

        List<LeaderboardEntry> entries = new ArrayList<>(raw.size());
        for (Object o : raw) {
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
            entries.add(LeaderboardEntry.builder()
                    .subjectId(e.getKey().toString())
                    .score(((Number) e.getValue()).longValue())
                    .periodKey(periodKey)
                    .build());
        }
        entries.sort(Comparator.comparingLong(LeaderboardEntry::getScore)
                .thenComparing(LeaderboardEntry::getSubjectId)
                .reversed());
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRank(i + 1);
        }
        return entries;
    }

    /**
     * @return 1-based rank, or null when the subject is not on the board
     */
    public Long findRank(String category, String periodKey, String subjectId) {
        Record record = client.operate(writePolicy, boardKey(category, periodKey),
                MapOperation.getByKey(SCORES_BIN, Value.get(subjectId), MapReturnType.REVERSE_RANK));
        if (record == null || record.getValue(SCORES_BIN) == null) return null;
        return record.getLong(SCORES_BIN) + 1;
    }

    public long countEntries(String category, String periodKey) {
        Record record = client.operate(writePolicy, boardKey(category, periodKey),
                MapOperation.size(SCORES_BIN));
        if (record == null || record.getValue(SCORES_BIN) == null) return 0;
        return record.getLong(SCORES_BIN);
    }

    /**
     * @return bins tipsSent, amountSent, tipsReceived, amountReceived; empty map for unknown users
     */
    public Map<String, Long> findUserTotals(String subjectId) {
        Record record = client.get(readPolicy, statsKey(subjectId));
        if (record == null) return Map.of();
        return Map.of(
                "tipsSent", record.getLong("tipsSent"),
                "amountSent", record.getLong("amountSent"),
                "tipsReceived", record.getLong("tipsReceived"),
                "amountReceived", record.getLong("amountReceived"));
    }

    public Map<String, Long> findWeeklyTotals(String subjectId, String weekKey) {
        Record record = client.get(readPolicy, weeklyStatsKey(subjectId, weekKey));
        if (record == null) return Map.of();
        return Map.of(
                "weeklyTips", record.getLong("weeklyTips"),
                "weeklyAmount", record.getLong("weeklyAmount"));
    }

    private Key boardKey(String category, String periodKey) {
        String name = ALL_TIME.equals(periodKey) ? category + ":all" : category + ":weekly:" + periodKey;
        return new Key(namespace, AerospikeConfig.SET_LEADERBOARDS, name);
    }

    private Key creditKey(String jobId) {
        return new Key(namespace, AerospikeConfig.SET_CREDITED_TIPS, jobId);
    }

    private Key statsKey(String subjectId) {
        return new Key(namespace, AerospikeConfig.SET_USER_TIP_STATS, subjectId);
    }

    private Key weeklyStatsKey(String subjectId, String weekKey) {
        return new Key(namespace, AerospikeConfig.SET_USER_WEEKLY_STATS, subjectId + ":" + weekKey);
    }

    private static Operation[] ops(Operation... operations) {
        return operations;
    }
}
