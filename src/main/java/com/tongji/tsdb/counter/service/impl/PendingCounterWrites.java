package com.tongji.tsdb.counter.service.impl;

import com.tongji.tsdb.schema.CounterKey;
import com.tongji.tsdb.store.PartitionCommands;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次调用内待写入的计数：按 (分片键, 字段) 合并增量，按分片键取最大过期时间。
 */
final class PendingCounterWrites {

    private final Map<String, Map<String, Long>> deltas = new LinkedHashMap<>();
    private final Map<String, Long> expiries = new LinkedHashMap<>();

    void add(CounterKey key, long delta, long expireAt) {
        deltas.computeIfAbsent(key.hashKey(), k -> new LinkedHashMap<>())
                .merge(key.field(), delta, PartitionCommands::saturatedAdd);
        expiries.merge(key.hashKey(), expireAt, Math::max);
    }

    boolean isEmpty() {
        return deltas.isEmpty();
    }

    Map<String, Map<String, Long>> deltas() {
        return deltas;
    }

    long expiry(String hashKey) {
        return expiries.get(hashKey);
    }
}
