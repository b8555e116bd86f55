package com.tongji.tsdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.cluster.DurabilityGuard;
import com.tongji.tsdb.cluster.Route;
import com.tongji.tsdb.config.TsdbProperties;
import com.tongji.tsdb.counter.service.impl.CounterStoreImpl;
import com.tongji.tsdb.distinct.service.impl.DistinctCounterStoreImpl;
import com.tongji.tsdb.frequency.schema.SketchParameters;
import com.tongji.tsdb.frequency.service.impl.FrequencySketchStoreImpl;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.schema.KeyCodec;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.memory.InMemoryPartition;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Test harness: one in-memory cluster named "default" with a fixed clock.
 */
public final class InMemoryTsdb implements AutoCloseable {

    /** Hour-aligned instant (multiple of 3600). */
    public static final long HOUR = 1_699_999_200L;
    /** Clock is pinned half an hour after {@link #HOUR}. */
    public static final Instant NOW = Instant.ofEpochSecond(HOUR + 1800);

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final KeyCodec keyCodec = new KeyCodec("ts:", 64);
    public final RollupScheduler scheduler;
    public final List<InMemoryPartition> partitions = new ArrayList<>();
    public final ClusterGroup cluster;
    public final ClusterRouter router;
    public final DurabilityGuard guard;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private InMemoryTsdb(int partitionCount, boolean durable, TsdbProperties.ReadFailure readFailure) {
        Map<Integer, Integer> rollups = new LinkedHashMap<>();
        rollups.put(10, 360);
        rollups.put(3600, 168);
        this.scheduler = new RollupScheduler(rollups, 360, clock);
        ObjectMapper objectMapper = new ObjectMapper();
        for (int i = 0; i < partitionCount; i++) {
            partitions.add(new InMemoryPartition("mem-" + i, clock, 14, objectMapper));
        }
        this.cluster = new ClusterGroup("default", new ArrayList<Partition>(partitions), executor);
        this.router = new ClusterRouter(Map.of("default", new Route(cluster, durable)), "default", "default", Map.of());
        this.guard = new DurabilityGuard(readFailure);
    }

    public static InMemoryTsdb durable(int partitionCount) {
        return new InMemoryTsdb(partitionCount, true, TsdbProperties.ReadFailure.SUPPRESS);
    }

    public static InMemoryTsdb bestEffort(int partitionCount) {
        return new InMemoryTsdb(partitionCount, false, TsdbProperties.ReadFailure.SUPPRESS);
    }

    public static InMemoryTsdb create(int partitionCount, boolean durable, TsdbProperties.ReadFailure readFailure) {
        return new InMemoryTsdb(partitionCount, durable, readFailure);
    }

    public CounterStoreImpl counterStore() {
        return new CounterStoreImpl(keyCodec, scheduler, router, guard);
    }

    public DistinctCounterStoreImpl distinctStore() {
        return new DistinctCounterStoreImpl(keyCodec, scheduler, router, guard, Duration.ofMinutes(1));
    }

    public FrequencySketchStoreImpl frequencyStore(int capacity, boolean enabled) {
        return new FrequencySketchStoreImpl(keyCodec, scheduler, router, guard,
                new SketchParameters(3, 128, capacity), enabled);
    }

    public InMemoryPartition partitionOf(String key) {
        return (InMemoryPartition) cluster.partitionFor(key);
    }

    public void setAvailable(boolean available) {
        partitions.forEach(p -> p.setAvailable(available));
    }

    public List<String> allKeys() {
        List<String> keys = new ArrayList<>();
        partitions.forEach(p -> keys.addAll(p.keys()));
        return keys;
    }

    public static Instant at(long epochSecond) {
        return Instant.ofEpochSecond(epochSecond);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
