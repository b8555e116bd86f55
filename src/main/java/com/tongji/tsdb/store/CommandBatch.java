package com.tongji.tsdb.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 一批待派发的命令，按分区归组为各自的管道。
 *
 * <p>两种入队方式：</p>
 * - map：{@link #add(String, StoreCommand, Function)} 按路由键定位所属分区；
 * - target：{@link #addTo(Partition, StoreCommand, Function)} 直接指定分区（跨分区归并时使用）。
 */
public final class CommandBatch {

    private final ClusterGroup cluster;
    private final Map<Partition, List<StoreCommand>> pipelines = new LinkedHashMap<>();

    CommandBatch(ClusterGroup cluster) {
        this.cluster = cluster;
    }

    public <T> Reply<T> add(String routingKey, StoreCommand command, Function<Object, T> decoder) {
        return addTo(cluster.partitionFor(routingKey), command, decoder);
    }

    public Reply<Object> add(String routingKey, StoreCommand command) {
        return add(routingKey, command, Function.identity());
    }

    public <T> Reply<T> addTo(Partition partition, StoreCommand command, Function<Object, T> decoder) {
        List<StoreCommand> pipeline = pipelines.computeIfAbsent(partition, p -> new ArrayList<>());
        pipeline.add(command);
        return new Reply<>(partition, pipeline.size() - 1, decoder);
    }

    public Reply<Object> addTo(Partition partition, StoreCommand command) {
        return addTo(partition, command, Function.identity());
    }

    public boolean isEmpty() {
        return pipelines.isEmpty();
    }

    Map<Partition, List<StoreCommand>> pipelines() {
        return Collections.unmodifiableMap(pipelines);
    }
}
