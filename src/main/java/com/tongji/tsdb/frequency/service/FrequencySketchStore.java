package com.tongji.tsdb.frequency.service;

import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.frequency.model.RankedMember;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 频次表：精确排行索引（容量有限）+ Count-Min 草图。
 *
 * <p>索引未满时所有权重精确；索引满后新出现的低频成员只进入草图，计数变为估计值，
 * 已在索引中的成员只要仍在榜上就保持精确。</p>
 * <p>功能按部署开启：关闭时写入与合并为空操作，查询抛出 ConfigurationException。</p>
 */
public interface FrequencySketchStore {

    /**
     * @param requests 实体 → (成员 → 正权重)
     */
    WriteOutcome record(TsdbModel model, Map<EntityKey, Map<String, Long>> requests, Instant timestamp, Long dimensionId);

    /**
     * 区间内按分数降序的排行，同分按成员字典序。
     * @param limit 为空表示不截断
     */
    Map<EntityKey, List<RankedMember>> ranked(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                              Integer rollup, Integer limit, Long dimensionId);

    /**
     * 指定成员在每个桶上的分数。
     */
    Map<EntityKey, List<Point<Map<String, Double>>>> estimate(TsdbModel model, Map<EntityKey, ? extends Collection<String>> items,
                                                              Instant start, Instant end, Integer rollup, Long dimensionId);

    /**
     * 指定成员在整个区间上的分数合计。
     */
    Map<EntityKey, Map<String, Double>> totals(TsdbModel model, Map<EntityKey, ? extends Collection<String>> items,
                                               Instant start, Instant end, Integer rollup, Long dimensionId);

    WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                       Instant timestamp, Collection<Long> dimensionIds);

    WriteOutcome delete(Collection<TsdbModel> models, Collection<EntityKey> keys, Instant start, Instant end,
                        Instant timestamp, Collection<Long> dimensionIds);
}
