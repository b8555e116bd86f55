package com.tongji.tsdb.store;

import java.util.List;
import java.util.Map;

/**
 * 批次执行结果，按句柄读取。
 */
public final class BatchResults {

    private final Map<Partition, List<Object>> results;

    BatchResults(Map<Partition, List<Object>> results) {
        this.results = results;
    }

    public <T> T get(Reply<T> reply) {
        List<Object> pipeline = results.get(reply.partition());
        if (pipeline == null || reply.index() >= pipeline.size()) {
            throw new IllegalStateException("No result for " + reply.partition().name() + "#" + reply.index());
        }
        return reply.decoder().apply(pipeline.get(reply.index()));
    }
}
