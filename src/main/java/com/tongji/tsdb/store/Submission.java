package com.tongji.tsdb.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 已派发但尚未等待完成的批次：每个分区一条独立管道。
 */
public record Submission(Map<Partition, CompletableFuture<List<Object>>> pipelines) {
}
