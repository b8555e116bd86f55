package com.tongji.tsdb.distinct.service.impl;

import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.cluster.DurabilityGuard;
import com.tongji.tsdb.cluster.Route;
import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.distinct.model.DistinctRecord;
import com.tongji.tsdb.distinct.service.DistinctCounterStore;
import com.tongji.tsdb.model.DimensionViews;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.ModelKind;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.rollup.RollupSeries;
import com.tongji.tsdb.schema.KeyCodec;
import com.tongji.tsdb.store.BatchResults;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.CommandBatch;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.Replies;
import com.tongji.tsdb.store.Reply;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * HyperLogLog 去重计数实现。
 *
 * <p>键即路由键：每个 (模型, 粒度, 桶, 实体, 维度) 一个 HyperLogLog，按键分布到分区。
 * 跨分区并集走两阶段归并：</p>
 * - 各分区先把本地键 PFMERGE 进临时键并读回原始字节；
 * - 部分结果汇总到协调分区（持有键最多的分区，同数取分区顺序靠前者）再合并计数；
 * - 所有临时键带 TTL，成功路径上显式删除。
 */
@Slf4j
public class DistinctCounterStoreImpl implements DistinctCounterStore {

    private final KeyCodec keyCodec;
    private final RollupScheduler scheduler;
    private final ClusterRouter router;
    private final DurabilityGuard guard;
    private final Duration temporaryKeyTtl;

    public DistinctCounterStoreImpl(KeyCodec keyCodec, RollupScheduler scheduler, ClusterRouter router,
                                    DurabilityGuard guard, Duration temporaryKeyTtl) {
        this.keyCodec = keyCodec;
        this.scheduler = scheduler;
        this.router = router;
        this.guard = guard;
        this.temporaryKeyTtl = temporaryKeyTtl;
    }

    @Override
    public WriteOutcome record(TsdbModel model, EntityKey key, Collection<String> values, Instant timestamp,
                               Long dimensionId) {
        return recordMulti(List.of(new DistinctRecord(model, key, values, timestamp, dimensionId)));
    }

    @Override
    public WriteOutcome recordMulti(List<DistinctRecord> records) {
        for (DistinctRecord record : records) {
            record.model().validate(ModelKind.DISTINCT, Collections.singletonList(record.dimensionId()));
        }
        Map<Route, CommandBatch> batches = new LinkedHashMap<>();
        for (DistinctRecord record : records) {
            if (record.values().isEmpty()) {
                continue;
            }
            String[] values = record.values().toArray(new String[0]);
            long timestamp = record.timestamp() == null ? scheduler.now() : record.timestamp().getEpochSecond();
            for (Long dimensionId : DimensionViews.forWrite(record.dimensionId())) {
                Route route = router.route(dimensionId);
                CommandBatch batch = batches.computeIfAbsent(route, r -> r.cluster().batch());
                scheduler.getRollups().forEach((rollup, samples) -> {
                    String key = keyCodec.makeKey(record.model(), rollup, timestamp, record.key(), dimensionId);
                    long expireAt = scheduler.calculateExpiry(rollup, samples, timestamp);
                    batch.add(key, c -> c.pfadd(key, values));
                    batch.add(key, c -> c.expireAt(key, expireAt));
                });
            }
        }
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Map.Entry<Route, CommandBatch> e : batches.entrySet()) {
            outcome = outcome.and(guard.write(e.getKey(), () -> e.getKey().cluster().execute(e.getValue())));
        }
        return outcome;
    }

    @Override
    public Map<EntityKey, List<Point<Long>>> cardinalitySeries(TsdbModel model, Collection<EntityKey> keys, Instant start,
                                                               Instant end, Integer rollup, Long dimensionId) {
        model.validate(ModelKind.DISTINCT, Collections.singletonList(dimensionId));
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        return guard.read(() -> {
            CommandBatch batch = cluster.batch();
            Map<EntityKey, List<Reply<Long>>> replies = new LinkedHashMap<>();
            for (EntityKey key : keys) {
                List<Reply<Long>> perKey = new ArrayList<>();
                for (long epoch : series.epochs()) {
                    String storageKey = keyCodec.makeKey(model, series.rollup(), epoch, key, dimensionId);
                    perKey.add(batch.add(storageKey, c -> c.pfcount(storageKey), Replies::asLong));
                }
                replies.put(key, perKey);
            }
            BatchResults results = cluster.execute(batch);
            Map<EntityKey, List<Point<Long>>> out = new LinkedHashMap<>();
            replies.forEach((key, perKey) -> {
                List<Point<Long>> points = new ArrayList<>(perKey.size());
                for (int i = 0; i < perKey.size(); i++) {
                    points.add(Point.of(series.epochs().get(i), results.get(perKey.get(i))));
                }
                out.put(key, points);
            });
            return out;
        }, () -> {
            Map<EntityKey, List<Point<Long>>> empty = new LinkedHashMap<>();
            for (EntityKey key : keys) {
                empty.put(key, series.epochs().stream().map(epoch -> Point.of(epoch, 0L)).toList());
            }
            return empty;
        });
    }

    /**
     * 实体的全部桶位于同一分区时用一次多键 PFCOUNT；否则对该实体单独做跨分区归并。
     */
    @Override
    public Map<EntityKey, Long> cardinalityTotals(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                                  Integer rollup, Long dimensionId) {
        model.validate(ModelKind.DISTINCT, Collections.singletonList(dimensionId));
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        return guard.read(() -> {
            Map<EntityKey, Long> totals = new LinkedHashMap<>();
            CommandBatch batch = cluster.batch();
            Map<EntityKey, Reply<Long>> local = new LinkedHashMap<>();
            for (EntityKey key : keys) {
                List<String> storageKeys = storageKeys(model, series, List.of(key), dimensionId);
                totals.put(key, 0L);
                Map<Partition, List<String>> byPartition = groupByPartition(cluster, storageKeys);
                if (byPartition.size() == 1) {
                    Map.Entry<Partition, List<String>> only = byPartition.entrySet().iterator().next();
                    String[] group = only.getValue().toArray(new String[0]);
                    local.put(key, batch.addTo(only.getKey(), c -> c.pfcount(group), Replies::asLong));
                } else if (byPartition.size() > 1) {
                    totals.put(key, union(cluster, byPartition));
                }
            }
            BatchResults results = cluster.execute(batch);
            local.forEach((key, reply) -> totals.put(key, results.get(reply)));
            return totals;
        }, () -> {
            Map<EntityKey, Long> empty = new LinkedHashMap<>();
            keys.forEach(key -> empty.put(key, 0L));
            return empty;
        });
    }

    @Override
    public long cardinalityUnion(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                 Integer rollup, Long dimensionId) {
        model.validate(ModelKind.DISTINCT, Collections.singletonList(dimensionId));
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        List<String> storageKeys = storageKeys(model, series, keys, dimensionId);
        return guard.read(() -> union(cluster, groupByPartition(cluster, storageKeys)), () -> 0L);
    }

    /**
     * 逐桶搬运：读出来源的原始字节并删除来源，再在目标分区写入临时键、PFMERGE 进目标并刷新过期。
     */
    @Override
    public WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                              Instant timestamp, Collection<Long> dimensionIds) {
        model.validate(ModelKind.DISTINCT, dimensionIds);
        Map<Integer, List<Long>> active = scheduler.activeSeries(null, null, timestamp);
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Map.Entry<Route, List<Long>> e : router.routeAll(DimensionViews.withAggregate(dimensionIds)).entrySet()) {
            Route route = e.getKey();
            outcome = outcome.and(guard.write(route,
                    () -> mergeOnCluster(route.cluster(), model, destination, sources, active, e.getValue())));
        }
        return outcome;
    }

    @Override
    public WriteOutcome delete(Collection<TsdbModel> models, Collection<EntityKey> keys, Instant start, Instant end,
                               Instant timestamp, Collection<Long> dimensionIds) {
        for (TsdbModel model : models) {
            model.validate(ModelKind.DISTINCT, dimensionIds);
        }
        Map<Integer, List<Long>> active = scheduler.activeSeries(start, end, timestamp);
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Map.Entry<Route, List<Long>> e : router.routeAll(DimensionViews.withAggregate(dimensionIds)).entrySet()) {
            ClusterGroup cluster = e.getKey().cluster();
            CommandBatch batch = cluster.batch();
            for (TsdbModel model : models) {
                for (Long dimensionId : e.getValue()) {
                    active.forEach((rollup, epochs) -> {
                        for (long epoch : epochs) {
                            for (EntityKey key : keys) {
                                String storageKey = keyCodec.makeKey(model, rollup, epoch, key, dimensionId);
                                batch.add(storageKey, c -> c.del(storageKey));
                            }
                        }
                    });
                }
            }
            outcome = outcome.and(guard.write(e.getKey(), () -> cluster.execute(batch)));
        }
        return outcome;
    }

    private void mergeOnCluster(ClusterGroup cluster, TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                                Map<Integer, List<Long>> active, List<Long> dimensionIds) {
        CommandBatch reads = cluster.batch();
        Map<String, Long> expiries = new LinkedHashMap<>();
        Map<String, List<Reply<byte[]>>> exported = new LinkedHashMap<>();
        for (Long dimensionId : dimensionIds) {
            active.forEach((rollup, epochs) -> {
                for (long epoch : epochs) {
                    String target = keyCodec.makeKey(model, rollup, epoch, destination, dimensionId);
                    expiries.put(target, scheduler.calculateExpiry(rollup, epoch));
                    List<Reply<byte[]>> replies = exported.computeIfAbsent(target, k -> new ArrayList<>());
                    for (EntityKey source : sources) {
                        if (source.equals(destination)) {
                            continue;
                        }
                        String from = keyCodec.makeKey(model, rollup, epoch, source, dimensionId);
                        replies.add(reads.add(from, c -> c.get(from), Replies::asBytes));
                        reads.add(from, c -> c.del(from));
                    }
                }
            });
        }
        BatchResults raw = cluster.execute(reads);

        String operationId = UUID.randomUUID().toString();
        long ttl = temporaryKeyTtl.toSeconds();
        CommandBatch writes = cluster.batch();
        int[] sequence = {0};
        exported.forEach((target, replies) -> {
            List<String> temporaries = new ArrayList<>();
            for (Reply<byte[]> reply : replies) {
                byte[] bytes = raw.get(reply);
                if (bytes == null) {
                    continue;
                }
                String temporary = keyCodec.temporaryKey(operationId, String.valueOf(sequence[0]++));
                temporaries.add(temporary);
                // 临时键按目标键路由，保证与目标同分区
                writes.add(target, c -> c.setWithTtl(temporary, bytes, ttl));
            }
            if (temporaries.isEmpty()) {
                return;
            }
            String[] parts = temporaries.toArray(new String[0]);
            long expireAt = expiries.get(target);
            writes.add(target, c -> c.pfmerge(target, parts));
            writes.add(target, c -> c.del(parts));
            writes.add(target, c -> c.expireAt(target, expireAt));
        });
        cluster.execute(writes);
        log.debug("Distinct merge applied model={} destination={} sources={} buckets={}",
                model, destination, sources.size(), exported.size());
    }

    private long union(ClusterGroup cluster, Map<Partition, List<String>> byPartition) {
        if (byPartition.isEmpty()) {
            return 0L;
        }
        if (byPartition.size() == 1) {
            Map.Entry<Partition, List<String>> only = byPartition.entrySet().iterator().next();
            String[] group = only.getValue().toArray(new String[0]);
            CommandBatch batch = cluster.batch();
            Reply<Long> count = batch.addTo(only.getKey(), c -> c.pfcount(group), Replies::asLong);
            return cluster.execute(batch).get(count);
        }

        String operationId = UUID.randomUUID().toString();
        long ttl = temporaryKeyTtl.toSeconds();
        long expireAt = scheduler.now() + ttl;

        // 第一阶段：各分区本地归并并导出原始字节
        CommandBatch local = cluster.batch();
        Map<Partition, Reply<byte[]>> partials = new LinkedHashMap<>();
        byPartition.forEach((partition, keys) -> {
            String temporary = keyCodec.temporaryKey(operationId, partition.name());
            String[] group = keys.toArray(new String[0]);
            local.addTo(partition, c -> c.pfmerge(temporary, group));
            local.addTo(partition, c -> c.expireAt(temporary, expireAt));
            partials.put(partition, local.addTo(partition, c -> c.get(temporary), Replies::asBytes));
            local.addTo(partition, c -> c.del(temporary));
        });
        BatchResults exported = cluster.execute(local);

        // 第二阶段：协调分区汇总
        Partition coordinator = coordinator(byPartition);
        CommandBatch reduce = cluster.batch();
        List<String> temporaries = new ArrayList<>();
        partials.forEach((partition, reply) -> {
            byte[] bytes = exported.get(reply);
            if (bytes == null) {
                return;
            }
            String temporary = keyCodec.temporaryKey(operationId, "partial:" + partition.name());
            temporaries.add(temporary);
            reduce.addTo(coordinator, c -> c.setWithTtl(temporary, bytes, ttl));
        });
        String result = keyCodec.temporaryKey(operationId, "union");
        String[] parts = temporaries.toArray(new String[0]);
        reduce.addTo(coordinator, c -> c.pfmerge(result, parts));
        reduce.addTo(coordinator, c -> c.expireAt(result, expireAt));
        Reply<Long> count = reduce.addTo(coordinator, c -> c.pfcount(result), Replies::asLong);
        List<String> cleanup = new ArrayList<>(temporaries);
        cleanup.add(result);
        String[] garbage = cleanup.toArray(new String[0]);
        reduce.addTo(coordinator, c -> c.del(garbage));
        long cardinality = cluster.execute(reduce).get(count);
        log.debug("Cross-partition union partitions={} coordinator={} cardinality={}",
                byPartition.size(), coordinator.name(), cardinality);
        return cardinality;
    }

    /** 持有键最多的分区；数量相同时取分区顺序靠前者。 */
    private static Partition coordinator(Map<Partition, List<String>> byPartition) {
        Partition best = null;
        int most = -1;
        for (Map.Entry<Partition, List<String>> e : byPartition.entrySet()) {
            if (e.getValue().size() > most) {
                best = e.getKey();
                most = e.getValue().size();
            }
        }
        return best;
    }

    /** 按分区归组，分区顺序与集群定义一致。 */
    private static Map<Partition, List<String>> groupByPartition(ClusterGroup cluster, Collection<String> keys) {
        Map<Partition, List<String>> grouped = new LinkedHashMap<>();
        for (Partition partition : cluster.partitions()) {
            grouped.put(partition, new ArrayList<>());
        }
        for (String key : keys) {
            grouped.get(cluster.partitionFor(key)).add(key);
        }
        grouped.values().removeIf(List::isEmpty);
        return grouped;
    }

    private List<String> storageKeys(TsdbModel model, RollupSeries series, Collection<EntityKey> keys, Long dimensionId) {
        Set<String> storageKeys = new LinkedHashSet<>();
        for (EntityKey key : keys) {
            for (long epoch : series.epochs()) {
                storageKeys.add(keyCodec.makeKey(model, series.rollup(), epoch, key, dimensionId));
            }
        }
        return new ArrayList<>(storageKeys);
    }
}
