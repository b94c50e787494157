package com.social.tipping.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.ListOperation;
import com.aerospike.client.cdt.ListOrder;
import com.aerospike.client.cdt.ListPolicy;
import com.aerospike.client.cdt.ListReturnType;
import com.aerospike.client.cdt.ListWriteFlags;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Repository
public class AerospikeCounterStore implements CounterStore {

    private static final String VALUE_BIN = "value";
    private static final String LIST_BIN = "entries";
    private static final ListPolicy ORDERED = new ListPolicy(ListOrder.ORDERED, ListWriteFlags.DEFAULT);

    // Aerospike expiration sentinel: leave the record's TTL untouched on update.
    private static final int KEEP_TTL = -2;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeCounterStore(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public List<Long> pruneWindow(String set, String key, long cutoffInclusive) {
        Key asKey = new Key(namespace, set, key);
        List<Long> entries = readList(client.get(readPolicy, asKey, LIST_BIN));
        if (entries.isEmpty() || entries.get(0) > cutoffInclusive) {
            return entries;
        }

        // Value ranges are end-exclusive, so cutoff + 1 removes everything <= cutoff.
        client.operate(withExpiration(KEEP_TTL), asKey,
                ListOperation.removeByValueRange(LIST_BIN, Value.getAsNull(),
                        Value.get(cutoffInclusive + 1), ListReturnType.NONE));

        List<Long> live = new ArrayList<>();
        for (Long ts : entries) {
            if (ts > cutoffInclusive) {
                live.add(ts);
            }
        }
        return live;
    }

    @Override
    public List<Long> readWindow(String set, String key) {
        return readList(client.get(readPolicy, new Key(namespace, set, key), LIST_BIN));
    }

    @Override
    public void appendToWindow(String set, String key, long timestamp, int ttlSeconds) {
        client.operate(withExpiration(ttlSeconds), new Key(namespace, set, key),
                ListOperation.append(ORDERED, LIST_BIN, Value.get(timestamp)));
    }

    @Override
    public long increment(String set, String key, long delta, int ttlSeconds) {
        Key asKey = new Key(namespace, set, key);
        Record record = client.operate(withExpiration(KEEP_TTL), asKey,
                Operation.add(new Bin(VALUE_BIN, delta)),
                Operation.get(VALUE_BIN));
        long value = record.getLong(VALUE_BIN);
        if (value == delta) {
            // First increment created the record: start its time-to-live now.
            client.touch(withExpiration(ttlSeconds), asKey);
        }
        return value;
    }

    @Override
    public Long getLong(String set, String key) {
        Record record = client.get(readPolicy, new Key(namespace, set, key), VALUE_BIN);
        if (record == null || record.getValue(VALUE_BIN) == null) return null;
        return record.getLong(VALUE_BIN);
    }

    @Override
    public void putLong(String set, String key, long value, int ttlSeconds) {
        client.put(withExpiration(ttlSeconds), new Key(namespace, set, key), new Bin(VALUE_BIN, value));
    }

    @Override
    public Double getDouble(String set, String key) {
        Record record = client.get(readPolicy, new Key(namespace, set, key), VALUE_BIN);
        if (record == null || record.getValue(VALUE_BIN) == null) return null;
        return record.getDouble(VALUE_BIN);
    }

    @Override
    public void putDouble(String set, String key, double value, int ttlSeconds) {
        client.put(withExpiration(ttlSeconds), new Key(namespace, set, key), new Bin(VALUE_BIN, value));
    }

    @Override
    public List<Long> getRecent(String set, String key) {
        return readList(client.get(readPolicy, new Key(namespace, set, key), LIST_BIN));
    }

    @Override
    public void pushRecent(String set, String key, long value, int maxSize, int ttlSeconds) {
        client.operate(withExpiration(ttlSeconds), new Key(namespace, set, key),
                ListOperation.insert(LIST_BIN, 0, Value.get(value)),
                ListOperation.trim(LIST_BIN, 0, maxSize));
    }

    @Override
    public void delete(String set, String key) {
        client.delete(writePolicy, new Key(namespace, set, key));
    }

    private WritePolicy withExpiration(int expiration) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = expiration;
        return policy;
    }

    private List<Long> readList(Record record) {
        if (record == null) return Collections.emptyList();
        List<?> raw = record.getList(LIST_BIN);
        if (raw == null) return Collections.emptyList();
        List<Long> values = new ArrayList<>(raw.size());
        for (Object o : raw) {
            values.add(((Number) o).longValue());
        }
        return values;
    }
}
