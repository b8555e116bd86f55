package com.tongji.tsdb.config;

import com.tongji.tsdb.cluster.ClusterRouter;
import com.tongji.tsdb.counter.service.CounterStore;
import com.tongji.tsdb.distinct.service.DistinctCounterStore;
import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.frequency.service.FrequencySketchStore;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.TsdbModel;
import com.tongji.tsdb.rollup.RollupScheduler;
import com.tongji.tsdb.schema.KeyCodec;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TsdbConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TsdbConfiguration.class)
            .withPropertyValues(
                    "tsdb.clusters.default.backend=memory",
                    "tsdb.clusters.default.partitions[0].name=mem-0",
                    "tsdb.clusters.default.partitions[1].name=mem-1");

    @Test
    void wires_all_stores_on_the_memory_backend() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(KeyCodec.class);
            assertThat(context).hasSingleBean(RollupScheduler.class);
            assertThat(context).hasSingleBean(ClusterRouter.class);
            assertThat(context).hasSingleBean(CounterStore.class);
            assertThat(context).hasSingleBean(DistinctCounterStore.class);
            assertThat(context).hasSingleBean(FrequencySketchStore.class);
            assertThat(context.getBean(RollupScheduler.class).getRollups()).containsOnlyKeys(10, 3600);
            assertThat(context.getBean(ClusterRouter.class).route(null).cluster().partitions()).hasSize(2);
        });
    }

    @Test
    void configured_rollups_replace_the_defaults() {
        runner.withPropertyValues("tsdb.rollups.60=1440").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(RollupScheduler.class).getRollups()).containsOnlyKeys(60);
        });
    }

    @Test
    void counters_round_trip_through_the_wired_store() {
        runner.run(context -> {
            CounterStore store = context.getBean(CounterStore.class);
            Instant now = Instant.now();
            store.increment(TsdbModel.PROJECT, EntityKey.of(1), null, 2, now);

            assertThat(store.sums(TsdbModel.PROJECT, List.of(EntityKey.of(1)), now, now, 10, null))
                    .containsEntry(EntityKey.of(1), 2L);
        });
    }

    @Test
    void sketch_depth_above_the_digest_limit_fails_startup() {
        runner.withPropertyValues("tsdb.sketch.depth=6").run(context -> assertThat(context).hasFailed());
    }

    @Test
    void routing_to_an_undefined_cluster_fails_startup() {
        runner.withPropertyValues("tsdb.routing.dimension-cluster=missing").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
        });
    }

    @Test
    void disabled_sketches_reject_queries() {
        runner.withPropertyValues("tsdb.sketch.enabled=false").run(context -> {
            FrequencySketchStore store = context.getBean(FrequencySketchStore.class);
            Instant now = Instant.now();

            assertThatThrownBy(() -> store.ranked(TsdbModel.FREQUENT_RELEASES_BY_GROUP, List.of(EntityKey.of(1)),
                    now, now, 3600, null, null)).isInstanceOf(ConfigurationException.class);
        });
    }
}
