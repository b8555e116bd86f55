package com.tongji.tsdb.counter.model;

import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.TsdbModel;

import java.time.Instant;

/**
 * 一条计数写入。
 * @param dimensionId 维度（可空，空表示只写聚合视图）
 * @param delta 非负增量，默认 1
 * @param timestamp 发生时间，空表示当前时间
 */
public record CounterIncrement(TsdbModel model, EntityKey key, Long dimensionId, long delta, Instant timestamp) {

    public static CounterIncrement of(TsdbModel model, EntityKey key) {
        return new CounterIncrement(model, key, null, 1L, null);
    }

    public static CounterIncrement of(TsdbModel model, EntityKey key, Long dimensionId, long delta, Instant timestamp) {
        return new CounterIncrement(model, key, dimensionId, delta, timestamp);
    }
}
