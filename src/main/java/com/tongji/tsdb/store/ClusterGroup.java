package com.tongji.tsdb.store;

import com.tongji.tsdb.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.zip.CRC32;

/**
 * 一组分区及其路由规则（CRC32(路由键) mod 分区数）。
 *
 * <p>执行模型：</p>
 * - 同一批次内的命令按分区归组，每个分区一条管道，分区内按提交顺序执行；
 * - 多个分区的管道并发派发，全部完成后才返回，分区之间无顺序保证；
 * - 两阶段接口：submit 派发得到 {@link Submission}，await 等待得到 {@link BatchResults}。
 */
@Slf4j
public class ClusterGroup implements AutoCloseable {

    private final String name;
    private final List<Partition> partitions;
    private final Executor executor;

    public ClusterGroup(String name, List<Partition> partitions, Executor executor) {
        if (partitions == null || partitions.isEmpty()) {
            throw new IllegalArgumentException("Cluster " + name + " has no partitions");
        }
        this.name = name;
        this.partitions = List.copyOf(partitions);
        this.executor = executor;
    }

    public String name() {
        return name;
    }

    public List<Partition> partitions() {
        return partitions;
    }

    public Partition partitionFor(String routingKey) {
        if (partitions.size() == 1) {
            return partitions.get(0);
        }
        CRC32 crc = new CRC32();
        crc.update(routingKey.getBytes(StandardCharsets.UTF_8));
        return partitions.get((int) (crc.getValue() % partitions.size()));
    }

    public CommandBatch batch() {
        return new CommandBatch(this);
    }

    public Submission submit(CommandBatch batch) {
        Map<Partition, List<StoreCommand>> pipelines = batch.pipelines();
        Map<Partition, CompletableFuture<List<Object>>> futures = new LinkedHashMap<>();
        boolean inline = pipelines.size() <= 1;
        pipelines.forEach((partition, commands) -> futures.put(partition, dispatch(partition, commands, inline)));
        return new Submission(futures);
    }

    /**
     * 等待所有分区管道完成；任一分区失败时抛出第一个失败，其余失败附加为 suppressed。
     */
    public BatchResults await(Submission submission) {
        Map<Partition, List<Object>> results = new LinkedHashMap<>();
        StoreUnavailableException failure = null;
        for (Map.Entry<Partition, CompletableFuture<List<Object>>> e : submission.pipelines().entrySet()) {
            try {
                results.put(e.getKey(), e.getValue().join());
            } catch (CompletionException ex) {
                StoreUnavailableException cause = unwrap(e.getKey(), ex);
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return new BatchResults(results);
    }

    public BatchResults execute(CommandBatch batch) {
        return await(submit(batch));
    }

    @Override
    public void close() {
        for (Partition partition : partitions) {
            try {
                partition.close();
            } catch (Exception ex) {
                log.warn("Failed to close partition cluster={} partition={}", name, partition.name(), ex);
            }
        }
    }

    private CompletableFuture<List<Object>> dispatch(Partition partition, List<StoreCommand> commands, boolean inline) {
        if (!inline) {
            return CompletableFuture.supplyAsync(() -> partition.execute(commands), executor);
        }
        // 单分区直接在调用线程执行，省去一次线程切换
        try {
            return CompletableFuture.completedFuture(partition.execute(commands));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static StoreUnavailableException unwrap(Partition partition, CompletionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof StoreUnavailableException sue) {
            return sue;
        }
        if (cause instanceof RuntimeException re && cause != ex) {
            throw re;
        }
        return new StoreUnavailableException(partition.name(), "Pipeline failed on " + partition.name(), cause);
    }
}
