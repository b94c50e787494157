package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.model.AchievementMilestone;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.Map;

/**
 * One record per (user, milestone). Create-only writes make awarding idempotent.
 */
@Repository
public class AchievementRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AchievementRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * @return true only for the call that first records the milestone
     */
    public boolean award(String userId, AchievementMilestone milestone, long awardedAt) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.expiration = -1;
        try {
            client.put(policy, key(userId, milestone),
                    new Bin("userId", userId),
                    new Bin("milestone", milestone.name()),
                    new Bin("awardedAt", awardedAt));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Milestones of the user with their award time.
     */
    public Map<AchievementMilestone, Long> findByUser(String userId) {
        Map<AchievementMilestone, Long> awarded = new EnumMap<>(AchievementMilestone.class);
        for (AchievementMilestone milestone : AchievementMilestone.values()) {
            Record record = client.get(readPolicy, key(userId, milestone));
            if (record != null) {
                awarded.put(milestone, record.getLong("awardedAt"));
            }
        }
        return awarded;
    }

    private Key key(String userId, AchievementMilestone milestone) {
        return new Key(namespace, AerospikeConfig.SET_ACHIEVEMENTS, userId + ":" + milestone.name());
    }
}
