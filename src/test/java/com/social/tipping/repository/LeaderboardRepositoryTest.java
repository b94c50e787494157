package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.BatchRecord;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.config.LeaderboardConfig;
import com.social.tipping.exception.TipPipelineException;
import com.social.tipping.model.LeaderboardEntry;
import com.social.tipping.model.TipTally;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.AbstractMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaderboardRepositoryTest {

    @Mock private AerospikeClient client;

    private final BatchPolicy batchPolicy = new BatchPolicy();
    private LeaderboardRepository repository;

    @BeforeEach
    void setUp() {
        repository = new LeaderboardRepository(client, "test", new WritePolicy(), new Policy(),
                batchPolicy, new LeaderboardConfig());
    }

    private static TipTally tally(String jobId, long amount) {
        return TipTally.builder()
                .jobId(jobId).senderId("s").recipientId("r").amount(amount).weekKey("2026-W42").build();
    }

    private static Key creditKey(String jobId) {
        return new Key("test", AerospikeConfig.SET_CREDITED_TIPS, jobId);
    }

    @Test
    @SuppressWarnings("unchecked")
    void applyTip_writesEveryAggregateInOneBatch() {
        when(client.operate(eq(batchPolicy), anyList())).thenReturn(true);

        boolean credited = repository.applyTip(tally("tip-s-r-1", 42L));

        assertThat(credited).isTrue();
        ArgumentCaptor<WritePolicy> markerPolicy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(markerPolicy.capture(), eq(creditKey("tip-s-r-1")), any(Bin.class));
        assertThat(markerPolicy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(markerPolicy.getValue().expiration).isEqualTo(new LeaderboardConfig().getCreditMarkerTtlSeconds());

        ArgumentCaptor<List<BatchRecord>> batch = ArgumentCaptor.forClass(List.class);
        verify(client).operate(eq(batchPolicy), batch.capture());
        assertThat(batch.getValue())
                .extracting(r -> r.key.setName + "/" + r.key.userKey)
                .containsExactly(
                        AerospikeConfig.SET_LEADERBOARDS + "/senders:all",
                        AerospikeConfig.SET_LEADERBOARDS + "/senders:weekly:2026-W42",
                        AerospikeConfig.SET_LEADERBOARDS + "/recipients:all",
                        AerospikeConfig.SET_LEADERBOARDS + "/recipients:weekly:2026-W42",
                        AerospikeConfig.SET_USER_TIP_STATS + "/s",
                        AerospikeConfig.SET_USER_TIP_STATS + "/r",
                        AerospikeConfig.SET_USER_WEEKLY_STATS + "/s:2026-W42");
    }

    @Test
    void applyTip_partialBatch_throws() {
        when(client.operate(eq(batchPolicy), anyList())).thenAnswer(inv -> {
            List<BatchRecord> records = inv.getArgument(1);
            records.forEach(r -> r.resultCode = ResultCode.OK);
            records.get(1).resultCode = ResultCode.TIMEOUT;
            return false;
        });

        assertThatThrownBy(() -> repository.applyTip(tally("tip-s-r-2", 1L)))
                .isInstanceOf(TipPipelineException.class)
                .hasMessageContaining("partially applied")
                .hasMessageContaining("senders:weekly:2026-W42");
        // increments that landed must not be repeated by a redelivery
        verify(client, never()).delete(any(WritePolicy.class), eq(creditKey("tip-s-r-2")));
    }

    @Test
    void applyTip_batchAppliedNothing_releasesCreditForRedelivery() {
        when(client.operate(eq(batchPolicy), anyList())).thenAnswer(inv -> {
            List<BatchRecord> records = inv.getArgument(1);
            records.forEach(r -> r.resultCode = ResultCode.TIMEOUT);
            return false;
        });

        assertThatThrownBy(() -> repository.applyTip(tally("tip-s-r-3", 1L)))
                .isInstanceOf(TipPipelineException.class)
                .hasMessageContaining("not applied");
        verify(client).delete(any(WritePolicy.class), eq(creditKey("tip-s-r-3")));
    }

    @Test
    void applyTip_sameJobTwice_secondDeliverySkipsIncrements() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(argThat(p -> p != null && p.recordExistsAction == RecordExistsAction.CREATE_ONLY),
                        eq(creditKey("tip-s-r-4")), any(Bin.class));

        assertThat(repository.applyTip(tally("tip-s-r-4", 5L))).isFalse();
        verify(client, never()).operate(any(BatchPolicy.class), anyList());
    }

    @Test
    void findTop_equalScores_followServerReverseRankOrder() {
        List<Object> raw = List.of(
                new AbstractMap.SimpleEntry<Object, Object>("carol", 50L),
                new AbstractMap.SimpleEntry<Object, Object>("bob", 90L),
                new AbstractMap.SimpleEntry<Object, Object>("alice", 90L));
        when(client.operate(any(WritePolicy.class), any(Key.class), any(Operation.class)))
                .thenReturn(new Record(Map.<String, Object>of("scores", raw), 1, 0));

        List<LeaderboardEntry> top = repository.findTop("senders", LeaderboardRepository.ALL_TIME, 3);

        assertThat(top).extracting(LeaderboardEntry::getSubjectId).containsExactly("bob", "alice", "carol");
        assertThat(top).extracting(LeaderboardEntry::getRank).containsExactly(1L, 2L, 3L);
        assertThat(top.get(0).getPeriodKey()).isEqualTo("all");
    }

    @Test
    void findRank_isOneBased() {
        when(client.operate(any(WritePolicy.class), any(Key.class), any(Operation.class)))
                .thenReturn(new Record(Map.<String, Object>of("scores", 0L), 1, 0));

        assertThat(repository.findRank("senders", "2026-W42", "alice")).isEqualTo(1L);
    }

    @Test
    void findUserTotals_unknownUser_isEmpty() {
        assertThat(repository.findUserTotals("ghost")).isEmpty();
    }
}
