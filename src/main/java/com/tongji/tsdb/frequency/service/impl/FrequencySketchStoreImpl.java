package com.tongji.tsdb.frequency.service.impl;

import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.cluster.DurabilityGuard;
import com.tongji.tsdb.cluster.Route;
import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.ValidationException;
import com.tongji.tsdb.frequency.model.RankedMember;
import com.tongji.tsdb.frequency.schema.CountMinScript;
import com.tongji.tsdb.frequency.schema.SketchParameters;
import com.tongji.tsdb.frequency.service.FrequencySketchStore;
import com.tongji.tsdb.model.DimensionViews;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.ModelKind;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.rollup.RollupSeries;
import com.tongji.tsdb.schema.FrequencyTableKeys;
import com.tongji.tsdb.schema.KeyCodec;
import com.tongji.tsdb.store.BatchResults;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.CommandBatch;
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
 * 频次草图实现：每个实体每次操作一次脚本调用，服务端原子执行。
 *
 * <p>同一实体的所有频次表（各粒度、各桶、各维度）按 {@link KeyCodec#routingKey} 落在同一分区，
 * 因此一次脚本调用可以覆盖整段查询区间。</p>
 */
@Slf4j
public class FrequencySketchStoreImpl implements FrequencySketchStore {

    private final KeyCodec keyCodec;
    private final RollupScheduler scheduler;
    private final ClusterRouter router;
    private final DurabilityGuard guard;
    private final SketchParameters parameters;
    private final boolean enabled;

    public FrequencySketchStoreImpl(KeyCodec keyCodec, RollupScheduler scheduler, ClusterRouter router,
                                    DurabilityGuard guard, SketchParameters parameters, boolean enabled) {
        this.keyCodec = keyCodec;
        this.scheduler = scheduler;
        this.router = router;
        this.guard = guard;
        this.parameters = parameters;
        this.enabled = enabled;
    }

    /**
     * 每个实体一次 INCR（携带全部粒度的表），随后为每个物理键设置该粒度的过期时间。
     */
    @Override
    public WriteOutcome record(TsdbModel model, Map<EntityKey, Map<String, Long>> requests, Instant timestamp,
                               Long dimensionId) {
        if (!enabled) {
            log.debug("Frequency sketches disabled, skip record model={} entities={}", model, requests.size());
            return WriteOutcome.delivered();
        }
        model.validate(ModelKind.FREQUENCY, Collections.singletonList(dimensionId));
        requests.forEach((key, weights) -> weights.forEach((member, weight) -> {
            if (weight == null || weight <= 0) {
                throw new ValidationException(ErrorCode.INVALID_ARGUMENT,
                        "频次权重必须为正数: %s=%s".formatted(member, weight));
            }
        }));
        long ts = timestamp == null ? scheduler.now() : timestamp.getEpochSecond();
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Long view : DimensionViews.forWrite(dimensionId)) {
            Route route = router.route(view);
            CommandBatch batch = route.cluster().batch();
            requests.forEach((key, weights) -> {
                if (weights.isEmpty()) {
                    return;
                }
                String routingKey = keyCodec.routingKey(model, key);
                List<String> keys = new ArrayList<>();
                Map<String, Long> expiries = new LinkedHashMap<>();
                scheduler.getRollups().forEach((rollup, samples) -> {
                    FrequencyTableKeys table = keyCodec.makeFrequencyTableKeys(model, rollup, ts, key, view);
                    keys.addAll(table.asList());
                    long expireAt = scheduler.calculateExpiry(rollup, samples, ts);
                    table.asList().forEach(k -> expiries.merge(k, expireAt, Math::max));
                });
                List<String> arguments = parameters.arguments(CountMinScript.INCR);
                weights.forEach((member, weight) -> {
                    arguments.add(String.valueOf(weight));
                    arguments.add(member);
                });
                batch.add(routingKey, c -> c.countMin(keys, arguments));
                expiries.forEach((k, expireAt) -> batch.add(routingKey, c -> c.expireAt(k, expireAt)));
            });
            outcome = outcome.and(guard.write(route, () -> route.cluster().execute(batch)));
        }
        return outcome;
    }

    @Override
    public Map<EntityKey, List<RankedMember>> ranked(TsdbModel model, Collection<EntityKey> keys, Instant start, Instant end,
                                                     Integer rollup, Integer limit, Long dimensionId) {
        ensureEnabled();
        model.validate(ModelKind.FREQUENCY, Collections.singletonList(dimensionId));
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        return guard.read(() -> {
            CommandBatch batch = cluster.batch();
            Map<EntityKey, Reply<List<RankedMember>>> replies = new LinkedHashMap<>();
            for (EntityKey key : keys) {
                List<String> tables = tableKeys(model, series, key, dimensionId);
                List<String> arguments = parameters.arguments(CountMinScript.RANKED);
                if (limit != null) {
                    arguments.add(String.valueOf(limit));
                }
                replies.put(key, batch.add(keyCodec.routingKey(model, key),
                        c -> c.countMin(tables, arguments), FrequencySketchStoreImpl::decodeRanked));
            }
            BatchResults results = cluster.execute(batch);
            Map<EntityKey, List<RankedMember>> out = new LinkedHashMap<>();
            replies.forEach((key, reply) -> out.put(key, results.get(reply)));
            return out;
        }, () -> {
            Map<EntityKey, List<RankedMember>> empty = new LinkedHashMap<>();
            keys.forEach(key -> empty.put(key, List.of()));
            return empty;
        });
    }

    @Override
    public Map<EntityKey, List<Point<Map<String, Double>>>> estimate(TsdbModel model,
                                                                     Map<EntityKey, ? extends Collection<String>> items,
                                                                     Instant start, Instant end, Integer rollup,
                                                                     Long dimensionId) {
        ensureEnabled();
        model.validate(ModelKind.FREQUENCY, Collections.singletonList(dimensionId));
        RollupSeries series = scheduler.series(start, end, rollup);
        ClusterGroup cluster = router.route(dimensionId).cluster();
        return guard.read(() -> {
            CommandBatch batch = cluster.batch();
            Map<EntityKey, Reply<List<?>>> replies = new LinkedHashMap<>();
            items.forEach((key, members) -> {
                List<String> tables = tableKeys(model, series, key, dimensionId);
                List<String> arguments = parameters.arguments(CountMinScript.ESTIMATE);
                arguments.addAll(members);
                replies.put(key, batch.add(keyCodec.routingKey(model, key),
                        c -> c.countMin(tables, arguments), Replies::asList));
            });
            BatchResults results = cluster.execute(batch);
            Map<EntityKey, List<Point<Map<String, Double>>>> out = new LinkedHashMap<>();
            replies.forEach((key, reply) -> {
                List<String> members = new ArrayList<>(items.get(key));
                List<?> perEpoch = results.get(reply);
                List<Point<Map<String, Double>>> points = new ArrayList<>(series.epochs().size());
                for (int i = 0; i < series.epochs().size(); i++) {
                    List<?> scores = i < perEpoch.size() ? Replies.asList(perEpoch.get(i)) : List.of();
                    Map<String, Double> byMember = new LinkedHashMap<>();
                    for (int m = 0; m < members.size(); m++) {
                        byMember.put(members.get(m), m < scores.size() ? Replies.asDouble(scores.get(m)) : 0.0d);
                    }
                    points.add(Point.of(series.epochs().get(i), byMember));
                }
                out.put(key, points);
            });
            return out;
        }, () -> {
            Map<EntityKey, List<Point<Map<String, Double>>>> empty = new LinkedHashMap<>();
            items.forEach((key, members) -> {
                List<Point<Map<String, Double>>> points = new ArrayList<>();
                for (long epoch : series.epochs()) {
                    Map<String, Double> zeros = new LinkedHashMap<>();
                    members.forEach(member -> zeros.put(member, 0.0d));
                    points.add(Point.of(epoch, zeros));
                }
                empty.put(key, points);
            });
            return empty;
        });
    }

    @Override
    public Map<EntityKey, Map<String, Double>> totals(TsdbModel model, Map<EntityKey, ? extends Collection<String>> items,
                                                      Instant start, Instant end, Integer rollup, Long dimensionId) {
        Map<EntityKey, Map<String, Double>> totals = new LinkedHashMap<>();
        estimate(model, items, start, end, rollup, dimensionId).forEach((key, points) -> {
            Map<String, Double> sum = new LinkedHashMap<>();
            items.get(key).forEach(member -> sum.put(member, 0.0d));
            for (Point<Map<String, Double>> point : points) {
                point.value().forEach((member, score) -> sum.merge(member, score, Double::sum));
            }
            totals.put(key, sum);
        });
        return totals;
    }

    /**
     * 两阶段：来源按粒度 EXPORT（导出后即删除），再逐份 IMPORT 进目标并刷新过期时间。
     */
    @Override
    public WriteOutcome merge(TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                              Instant timestamp, Collection<Long> dimensionIds) {
        if (!enabled) {
            log.debug("Frequency sketches disabled, skip merge model={} destination={}", model, destination);
            return WriteOutcome.delivered();
        }
        model.validate(ModelKind.FREQUENCY, dimensionIds);
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
            model.validate(ModelKind.FREQUENCY, dimensionIds);
        }
        Map<Integer, List<Long>> active = scheduler.activeSeries(start, end, timestamp);
        WriteOutcome outcome = WriteOutcome.delivered();
        for (Map.Entry<Route, List<Long>> e : router.routeAll(DimensionViews.withAggregate(dimensionIds)).entrySet()) {
            ClusterGroup cluster = e.getKey().cluster();
            CommandBatch batch = cluster.batch();
            for (TsdbModel model : models) {
                for (EntityKey key : keys) {
                    List<String> tables = new ArrayList<>();
                    for (Long dimensionId : e.getValue()) {
                        active.forEach((rollup, epochs) -> {
                            for (long epoch : epochs) {
                                tables.addAll(keyCodec.makeFrequencyTableKeys(model, rollup, epoch, key, dimensionId).asList());
                            }
                        });
                    }
                    if (!tables.isEmpty()) {
                        String[] doomed = tables.toArray(new String[0]);
                        batch.add(keyCodec.routingKey(model, key), c -> c.del(doomed));
                    }
                }
            }
            outcome = outcome.and(guard.write(e.getKey(), () -> cluster.execute(batch)));
        }
        return outcome;
    }

    private void mergeOnCluster(ClusterGroup cluster, TsdbModel model, EntityKey destination, Collection<EntityKey> sources,
                                Map<Integer, List<Long>> active, List<Long> dimensionIds) {
        String target = keyCodec.routingKey(model, destination);
        CommandBatch exports = cluster.batch();
        // (目标表键, 导出结果, 对应粒度)
        List<PendingImport> pending = new ArrayList<>();
        for (Long dimensionId : dimensionIds) {
            active.forEach((rollup, epochs) -> {
                if (epochs.isEmpty()) {
                    return;
                }
                List<String> destinationTables = new ArrayList<>();
                for (long epoch : epochs) {
                    destinationTables.addAll(keyCodec.makeFrequencyTableKeys(model, rollup, epoch, destination, dimensionId).asList());
                }
                for (EntityKey source : sources) {
                    if (source.equals(destination)) {
                        continue;
                    }
                    List<String> sourceTables = new ArrayList<>();
                    for (long epoch : epochs) {
                        sourceTables.addAll(keyCodec.makeFrequencyTableKeys(model, rollup, epoch, source, dimensionId).asList());
                    }
                    List<String> arguments = parameters.arguments(CountMinScript.EXPORT);
                    Reply<List<?>> reply = exports.add(keyCodec.routingKey(model, source),
                            c -> c.countMin(sourceTables, arguments), Replies::asList);
                    pending.add(new PendingImport(destinationTables, reply, rollup, epochs));
                }
            });
        }
        BatchResults exported = cluster.execute(exports);

        CommandBatch imports = cluster.batch();
        for (PendingImport item : pending) {
            List<String> arguments = parameters.arguments(CountMinScript.IMPORT);
            for (Object payload : exported.get(item.exported())) {
                arguments.add(Replies.asString(payload));
            }
            imports.add(target, c -> c.countMin(item.tables(), arguments));
            for (int i = 0; i < item.epochs().size(); i++) {
                long expireAt = scheduler.calculateExpiry(item.rollup(), item.epochs().get(i));
                String indexKey = item.tables().get(2 * i);
                String sketchKey = item.tables().get(2 * i + 1);
                imports.add(target, c -> c.expireAt(indexKey, expireAt));
                imports.add(target, c -> c.expireAt(sketchKey, expireAt));
            }
        }
        cluster.execute(imports);
        log.debug("Frequency merge applied model={} destination={} sources={} imports={}",
                model, destination, sources.size(), pending.size());
    }

    private List<String> tableKeys(TsdbModel model, RollupSeries series, EntityKey key, Long dimensionId) {
        List<String> tables = new ArrayList<>(series.epochs().size() * 2);
        for (long epoch : series.epochs()) {
            tables.addAll(keyCodec.makeFrequencyTableKeys(model, series.rollup(), epoch, key, dimensionId).asList());
        }
        return tables;
    }

    private void ensureEnabled() {
        if (!enabled) {
            throw new ConfigurationException(ErrorCode.SKETCHES_DISABLED, "频次草图未启用，无法查询");
        }
    }

    private static List<RankedMember> decodeRanked(Object raw) {
        List<RankedMember> ranked = new ArrayList<>();
        for (Object entry : Replies.asList(raw)) {
            List<?> pair = Replies.asList(entry);
            ranked.add(new RankedMember(Replies.asString(pair.get(0)), Replies.asDouble(pair.get(1))));
        }
        return ranked;
    }

    private record PendingImport(List<String> tables, Reply<List<?>> exported, int rollup, List<Long> epochs) {
    }
}
