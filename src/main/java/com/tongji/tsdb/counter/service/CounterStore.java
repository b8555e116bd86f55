package com.tongji.tsdb.counter.service;

import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.counter.model.CounterIncrement;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface CounterStore {

    /**
     * 批量累加：同一次调用内相同 (分片键, 字段) 的增量先在本地合并，再按分区管道写入。
     * 每条写入同时落到维度视图与聚合视图。
     */
    WriteOutcome increment(List<CounterIncrement> increments);

    default WriteOutcome increment(TsdbModel model, EntityKey key, Long dimensionId, long delta, Instant timestamp) {
        return increment(List.of(CounterIncrement.of(model, key, dimensionId, delta, timestamp)));
    }

    /**
     * 区间计数序列，缺失的桶读作 0。
     * @param rollup 为空时按点数预算自动选择
     * @param dimensionIds 至多一个维度，空表示聚合视图
     */
    Map<EntityKey, List<Point<Long>>> range(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                            Integer rollup, Collection<Long> dimensionIds);

    /**
     * 区间内各实体的计数总和。
     */
    Map<EntityKey, Long> sums(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                              Integer rollup, Collection<Long> dimensionIds);

    /**
     * 把 sources 在所有仍可查询的桶上的计数搬到 destination，sources 清零。
     */
    WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                       Instant timestamp, Collection<Long> dimensionIds);

    /**
     * 删除字段；分片 Hash 本身交给过期回收。
     */
    WriteOutcome delete(Collection<TsdbModel> models, Collection<EntityKey> keys, Instant start, Instant end,
                        Instant timestamp, Collection<Long> dimensionIds);
}
