package com.tongji.tsdb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.cluster.DurabilityGuard;
import com.tongji.tsdb.cluster.Route;
import com.tongji.tsdb.counter.service.CounterStore;
import com.tongji.tsdb.counter.service.impl.CounterStoreImpl;
import com.tongji.tsdb.distinct.service.DistinctCounterStore;
import com.tongji.tsdb.distinct.service.impl.DistinctCounterStoreImpl;
import com.tongji.tsdb.frequency.schema.SketchParameters;
import com.tongji.tsdb.frequency.service.FrequencySketchStore;
import com.tongji.tsdb.frequency.service.impl.FrequencySketchStoreImpl;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.schema.KeyCodec;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.memory.InMemoryPartition;
import com.tongji.tsdb.store.redis.RedisPartition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 时序引擎装配：键编码、粒度注册表、集群路由与三类存储。
 * <p>
 * 配置错误（未定义的集群、非法粒度、草图参数越界）在容器启动时直接失败。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TsdbProperties.class)
public class TsdbConfiguration {

    @Bean
    public KeyCodec keyCodec(TsdbProperties properties) {
        return new KeyCodec(properties.getPrefix(), properties.getVnodes());
    }

    @Bean
    public RollupScheduler rollupScheduler(TsdbProperties properties, ObjectProvider<Clock> clock) {
        return new RollupScheduler(properties.resolvedRollups(), properties.getMaxPoints(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService tsdbPipelineExecutor(TsdbProperties properties) {
        // 每个分区管道一个任务，线程数即可同时派发的分区数
        return Executors.newFixedThreadPool(properties.getPipelineThreads(),
                new CustomizableThreadFactory("tsdb-pipeline-"));
    }

    @Bean(destroyMethod = "close")
    public ClusterRouter clusterRouter(TsdbProperties properties, ExecutorService tsdbPipelineExecutor,
                                       ObjectProvider<Clock> clock, ObjectProvider<ObjectMapper> objectMapper) {
        Map<String, Route> routes = new LinkedHashMap<>();
        properties.getClusters().forEach((name, cluster) -> {
            List<Partition> partitions = new ArrayList<>();
            for (TsdbProperties.Node node : cluster.getPartitions()) {
                partitions.add(switch (cluster.getBackend()) {
                    case REDIS -> RedisPartition.connect(node, cluster.getCommandTimeout());
                    case MEMORY -> new InMemoryPartition(node.getName(), clock.getIfAvailable(Clock::systemUTC),
                            properties.getMemory().getHllLgK(), objectMapper.getIfAvailable(ObjectMapper::new));
                });
            }
            routes.put(name, new Route(new ClusterGroup(name, partitions, tsdbPipelineExecutor), cluster.isDurable()));
            log.info("Cluster configured name={} backend={} partitions={} durable={}",
                    name, cluster.getBackend(), partitions.size(), cluster.isDurable());
        });
        TsdbProperties.Routing routing = properties.getRouting();
        return new ClusterRouter(routes, routing.getAggregateCluster(), routing.getDimensionCluster(),
                routing.getDimensionOverrides());
    }

    @Bean
    public DurabilityGuard durabilityGuard(TsdbProperties properties) {
        return new DurabilityGuard(properties.getReadFailure());
    }

    @Bean
    public CounterStore counterStore(KeyCodec keyCodec, RollupScheduler rollupScheduler, ClusterRouter clusterRouter,
                                     DurabilityGuard durabilityGuard) {
        return new CounterStoreImpl(keyCodec, rollupScheduler, clusterRouter, durabilityGuard);
    }

    @Bean
    public DistinctCounterStore distinctCounterStore(TsdbProperties properties, KeyCodec keyCodec,
                                                     RollupScheduler rollupScheduler, ClusterRouter clusterRouter,
                                                     DurabilityGuard durabilityGuard) {
        return new DistinctCounterStoreImpl(keyCodec, rollupScheduler, clusterRouter, durabilityGuard,
                properties.getTemporaryKeyTtl());
    }

    @Bean
    public FrequencySketchStore frequencySketchStore(TsdbProperties properties, KeyCodec keyCodec,
                                                     RollupScheduler rollupScheduler, ClusterRouter clusterRouter,
                                                     DurabilityGuard durabilityGuard) {
        TsdbProperties.Sketch sketch = properties.getSketch();
        SketchParameters parameters = new SketchParameters(sketch.getDepth(), sketch.getWidth(), sketch.getCapacity());
        return new FrequencySketchStoreImpl(keyCodec, rollupScheduler, clusterRouter, durabilityGuard,
                parameters, sketch.isEnabled());
    }
}
