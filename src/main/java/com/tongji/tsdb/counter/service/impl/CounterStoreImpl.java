package com.tongji.tsdb.counter.service.impl;

import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.cluster.DurabilityGuard;
import com.tongji.tsdb.cluster.Route;
import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.counter.model.CounterIncrement;
import com.tongji.tsdb.counter.service.CounterStore;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.ValidationException;
import com.tongji.tsdb.model.DimensionViews;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.ModelKind;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.rollup.RollupSeries;
import com.tongji.tsdb.schema.CounterKey;
import com.tongji.tsdb.schema.KeyCodec;
import com.tongji.tsdb.store.BatchResults;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.CommandBatch;
import com.tongji.tsdb.store.PartitionCommands;
import com.tongji.tsdb.store.Replies;
import com.tongji.tsdb.store.Reply;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分片 Hash 计数实现。
 *
 * <p>存储布局：</p>
 * - 每个 (模型, 粒度, 桶, vnode) 一个 Hash，field 为实体（可带维度后缀），value 为计数；
 * - 同一桶内的实体按 vnode 打散到多个 Hash，避免单个大 Hash；
 * - 写入只用饱和 HINCRBY + EXPIREAT，两者都可交换，多写者无需加锁。
 */
@Slf4j
public class CounterStoreImpl implements CounterStore {

    private final KeyCodec keyCodec;
    private final RollupScheduler scheduler;
    private final ClusterRouter router;
    private final DurabilityGuard guard;

    public CounterStoreImpl(KeyCodec keyCodec, RollupScheduler scheduler, ClusterRouter router, DurabilityGuard guard) {
        this.keyCodec = keyCodec;
        this.scheduler = scheduler;
        this.router = router;
        this.guard = guard;
    }

    @Override
    public WriteOutcome increment(List<CounterIncrement> increments) {
        for (CounterIncrement increment : increments) {
            increment.model().validate(ModelKind.COUNTER, Collections.singletonList(increment.dimensionId()));
            if (increment.delta() < 0) {
                throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "计数增量不能为负: " + increment.delta());
            }
        }
        // 先在本地按路由合并，再逐路由一次性下发
        Map<Route, PendingCounterWrites> pending = new LinkedHashMap<>();
        for (CounterIncrement increment : increments) {
            long timestamp = increment.timestamp() == null ? scheduler.now() : increment.timestamp().getEpochSecond();
            for (Long dimensionId : DimensionViews.forWrite(increment.dimensionId())) {
                PendingCounterWrites writes = pending.computeIfAbsent(router.route(dimensionId), r -> new PendingCounterWrites());
                scheduler.getRollups().forEach((rollup, samples) -> {
                    CounterKey key = keyCodec.makeCounterKey(increment.model(), rollup, timestamp, increment.key(), dimensionId);
                    writes.add(key, increment.delta(), scheduler.calculateExpiry(rollup, samples, timestamp));
                });
            }
        }
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Map.Entry<Route, PendingCounterWrites> e : pending.entrySet()) {
            outcome = outcome.and(guard.write(e.getKey(), () -> flush(e.getKey().cluster(), e.getValue())));
        }
        return outcome;
    }

    @Override
    public Map<EntityKey, List<Point<Long>>> range(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                                   Integer rollup, Collection<Long> dimensionIds) {
        Long dimensionId = singleDimension(model, dimensionIds);
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        return guard.read(() -> {
            CommandBatch batch = cluster.batch();
            Map<EntityKey, List<Reply<Long>>> replies = new LinkedHashMap<>();
            for (EntityKey key : keys) {
                List<Reply<Long>> perKey = new ArrayList<>(series.epochs().size());
                for (long epoch : series.epochs()) {
                    CounterKey counterKey = keyCodec.makeCounterKey(model, series.rollup(), epoch, key, dimensionId);
                    perKey.add(batch.add(counterKey.hashKey(),
                            c -> c.hget(counterKey.hashKey(), counterKey.field()), Replies::asLong));
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
        }, () -> zeros(keys, series));
    }

    @Override
    public Map<EntityKey, Long> sums(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                     Integer rollup, Collection<Long> dimensionIds) {
        Map<EntityKey, Long> sums = new LinkedHashMap<>();
        range(model, keys, start, end, rollup, dimensionIds).forEach((key, points) ->
                sums.put(key, points.stream().mapToLong(Point::value).reduce(0L, PartitionCommands::saturatedAdd)));
        return sums;
    }

    /**
     * 两阶段：先在各分区原子取走（读并删除）所有来源字段，再把每个桶的合计写入目标。
     * 单个桶内不会重复计数或丢数；桶与桶之间不保证同时完成。
     */
    @Override
    public WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                              Instant timestamp, Collection<Long> dimensionIds) {
        model.validate(ModelKind.COUNTER, dimensionIds);
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
            model.validate(ModelKind.COUNTER, dimensionIds);
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
                                CounterKey counterKey = keyCodec.makeCounterKey(model, rollup, epoch, key, dimensionId);
                                batch.add(counterKey.hashKey(), c -> c.hdel(counterKey.hashKey(), counterKey.field()));
                            }
                        }
                    });
                }
            }
            outcome = outcome.and(guard.write(e.getKey(), () -> cluster.execute(batch)));
        }
        return outcome;
    }

    private void flush(ClusterGroup cluster, PendingCounterWrites writes) {
        CommandBatch batch = cluster.batch();
        writes.deltas().forEach((hashKey, fields) -> {
            fields.forEach((field, delta) -> batch.add(hashKey, c -> c.hincrBy(hashKey, field, delta)));
            long expireAt = writes.expiry(hashKey);
            batch.add(hashKey, c -> c.expireAt(hashKey, expireAt));
        });
        cluster.execute(batch);
    }

    private void mergeOnCluster(ClusterGroup cluster, TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                                Map<Integer, List<Long>> active, List<Long> dimensionIds) {
        CommandBatch takes = cluster.batch();
        Map<CounterKey, List<Reply<Long>>> drained = new LinkedHashMap<>();
        Map<CounterKey, Long> expiries = new LinkedHashMap<>();
        for (Long dimensionId : dimensionIds) {
            active.forEach((rollup, epochs) -> {
                for (long epoch : epochs) {
                    CounterKey target = keyCodec.makeCounterKey(model, rollup, epoch, destination, dimensionId);
                    List<Reply<Long>> replies = drained.computeIfAbsent(target, k -> new ArrayList<>());
                    expiries.put(target, scheduler.calculateExpiry(rollup, epoch));
                    for (EntityKey source : sources) {
                        if (source.equals(destination)) {
                            continue;
                        }
                        CounterKey from = keyCodec.makeCounterKey(model, rollup, epoch, source, dimensionId);
                        replies.add(takes.add(from.hashKey(), c -> c.hashTake(from.hashKey(), from.field()), Replies::asLong));
                    }
                }
            });
        }
        BatchResults taken = cluster.execute(takes);

        CommandBatch writes = cluster.batch();
        drained.forEach((target, replies) -> {
            long total = 0L;
            for (Reply<Long> reply : replies) {
                total = PartitionCommands.saturatedAdd(total, taken.get(reply));
            }
            if (total == 0L) {
                return;
            }
            long delta = total;
            long expireAt = expiries.get(target);
            writes.add(target.hashKey(), c -> c.hincrBy(target.hashKey(), target.field(), delta));
            writes.add(target.hashKey(), c -> c.expireAt(target.hashKey(), expireAt));
        });
        cluster.execute(writes);
        log.debug("Counter merge applied model={} destination={} sources={} buckets={}",
                model, destination, sources.size(), drained.size());
    }

    private static Long singleDimension(TsdbModel model, Collection<Long> dimensionIds) {
        if (dimensionIds != null && dimensionIds.size() > 1) {
            throw new ValidationException(ErrorCode.MULTIPLE_DIMENSION_FILTERS,
                    "计数查询同时只支持一个维度过滤，收到 " + dimensionIds.size() + " 个");
        }
        model.validate(ModelKind.COUNTER, dimensionIds);
        return dimensionIds == null || dimensionIds.isEmpty() ? null : dimensionIds.iterator().next();
    }

    private static Map<EntityKey, List<Point<Long>>> zeros(Collection<EntityKey> keys, RollupSeries series) {
        Map<EntityKey, List<Point<Long>>> out = new LinkedHashMap<>();
        for (EntityKey key : keys) {
            List<Point<Long>> points = new ArrayList<>(series.epochs().size());
            for (long epoch : series.epochs()) {
                points.add(Point.of(epoch, 0L));
            }
            out.put(key, points);
        }
        return out;
    }
}
