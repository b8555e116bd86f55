package com.tongji.tsdb.distinct.service;

import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.distinct.model.DistinctRecord;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 基于 HyperLogLog 的去重计数（近似值，相对标准误差约 0.8%）。
 * 缺失的键按基数 0 处理，查询从不因数据缺失而报错。
 */
public interface DistinctCounterStore {

    WriteOutcome record(TsdbModel model, EntityKey key, Collection<String> values, Instant timestamp, Long dimensionId);

    /**
     * 批量写入，按路由合并为每分区一条管道。
     */
    WriteOutcome recordMulti(List<DistinctRecord> records);

    /**
     * 每个 (实体, 桶) 一次基数读取。
     */
    Map<EntityKey, List<Point<Long>>> cardinalitySeries(TsdbModel model, Collection<EntityKey> keys, Instant start,
                                                        Instant end, Integer rollup, Long dimensionId);

    /**
     * 每个实体在整个区间上的去重数量。
     */
    Map<EntityKey, Long> cardinalityTotals(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                           Integer rollup, Long dimensionId);

    /**
     * 全部实体、全部桶的并集基数；跨分区时两阶段归并，网络传输量与分区数成正比。
     */
    long cardinalityUnion(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                          Integer rollup, Long dimensionId);

    WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                       Instant timestamp, Collection<Long> dimensionIds);

    WriteOutcome delete(Collection<TsdbModel> models, Collection<EntityKey> keys, Instant start, Instant end,
                        Instant timestamp, Collection<Long> dimensionIds);
}
