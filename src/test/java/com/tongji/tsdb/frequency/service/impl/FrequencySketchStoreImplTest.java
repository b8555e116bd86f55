package com.tongji.tsdb.frequency.service.impl;

import com.tongji.tsdb.InMemoryTsdb;
import com.tongji.tsdb.cluster.WriteOutcome;
import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.ValidationException;
import com.tongji.tsdb.frequency.model.RankedMember;
import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.Point;
import com.tongji.tsdb.model.TsdbModel;
import com.tongji.tsdb.schema.FrequencyTableKeys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tongji.tsdb.InMemoryTsdb.HOUR;
import static com.tongji.tsdb.InMemoryTsdb.at;
import static org.junit.jupiter.api.Assertions.*;

class FrequencySketchStoreImplTest {

    private static final TsdbModel M = TsdbModel.FREQUENT_RELEASES_BY_GROUP;

    private final InMemoryTsdb tsdb = InMemoryTsdb.durable(2);
    private final FrequencySketchStoreImpl store = tsdb.frequencyStore(5, true);

    @AfterEach
    void close() {
        tsdb.close();
    }

    private List<RankedMember> ranked(long entity, Integer limit) {
        return store.ranked(M, List.of(EntityKey.of(entity)), at(HOUR), at(HOUR), 3600, limit, null)
                .get(EntityKey.of(entity));
    }

    private static Map<EntityKey, Map<String, Long>> request(long entity, Object... memberWeights) {
        Map<String, Long> weights = new LinkedHashMap<>();
        for (int i = 0; i < memberWeights.length; i += 2) {
            weights.put((String) memberWeights[i], ((Number) memberWeights[i + 1]).longValue());
        }
        return Map.of(EntityKey.of(entity), weights);
    }

    @Test
    void scores_are_exact_within_index_capacity() {
        store.record(M, request(1, "a", 5, "b", 3, "c", 9), at(HOUR), null);
        store.record(M, request(1, "a", 1), at(HOUR + 60), null);

        assertEquals(List.of(new RankedMember("c", 9), new RankedMember("a", 6), new RankedMember("b", 3)),
                ranked(1, null));
    }

    @Test
    void equal_scores_rank_by_member() {
        store.record(M, request(1, "b", 2, "a", 2), at(HOUR), null);

        assertEquals(List.of(new RankedMember("a", 2), new RankedMember("b", 2)), ranked(1, null));
    }

    @Test
    void limit_truncates_the_ranking() {
        store.record(M, request(1, "a", 5, "b", 3, "c", 9), at(HOUR), null);

        assertEquals(List.of(new RankedMember("c", 9), new RankedMember("a", 5)), ranked(1, 2));
    }

    @Test
    void heavy_hitters_stay_exact_once_the_index_is_full() {
        store.record(M, request(1, "r1", 100, "r2", 90, "r3", 80, "r4", 70, "r5", 60), at(HOUR), null);
        Map<String, Long> tail = new LinkedHashMap<>();
        for (int i = 0; i < 40; i++) {
            tail.put("noise-" + i, 1L);
        }
        store.record(M, Map.of(EntityKey.of(1), tail), at(HOUR), null);

        List<RankedMember> ranked = ranked(1, null);

        assertEquals(5, ranked.size());
        assertEquals(new RankedMember("r1", 100), ranked.get(0));
        assertEquals(new RankedMember("r2", 90), ranked.get(1));
        assertEquals(new RankedMember("r3", 80), ranked.get(2));
    }

    @Test
    void estimate_returns_one_score_map_per_bucket() {
        store.record(M, request(1, "a", 2, "b", 1), at(HOUR), null);
        store.record(M, request(1, "a", 3), at(HOUR + 3600), null);

        List<Point<Map<String, Double>>> series = store.estimate(M, Map.of(EntityKey.of(1), List.of("a", "b")),
                at(HOUR), at(HOUR + 3600), 3600, null).get(EntityKey.of(1));

        assertEquals(2, series.size());
        assertEquals(Map.of("a", 2.0d, "b", 1.0d), series.get(0).value());
        assertEquals(3.0d, series.get(1).value().get("a"));
    }

    @Test
    void totals_sum_estimates_over_the_range() {
        store.record(M, request(1, "a", 2, "b", 1), at(HOUR), null);
        store.record(M, request(1, "a", 3), at(HOUR + 3600), null);

        Map<String, Double> totals = store.totals(M, Map.of(EntityKey.of(1), List.of("a", "b", "missing")),
                at(HOUR), at(HOUR + 3600), 3600, null).get(EntityKey.of(1));

        assertEquals(5.0d, totals.get("a"));
        assertEquals(1.0d, totals.get("b"));
        assertEquals(0.0d, totals.get("missing"));
    }

    @Test
    void dimension_records_feed_the_aggregate_view() {
        store.record(M, request(1, "a", 4), at(HOUR), 8L);

        assertEquals(List.of(new RankedMember("a", 4)),
                store.ranked(M, List.of(EntityKey.of(1)), at(HOUR), at(HOUR), 3600, null, 8L).get(EntityKey.of(1)));
        assertEquals(List.of(new RankedMember("a", 4)), ranked(1, null));
    }

    @Test
    void record_sets_retention_expiry_on_both_tables() {
        store.record(M, request(1, "a", 1), at(HOUR + 5), null);

        FrequencyTableKeys keys = tsdb.keyCodec.makeFrequencyTableKeys(M, 10, HOUR, EntityKey.of(1), null);
        String routing = tsdb.keyCodec.routingKey(M, EntityKey.of(1));
        assertEquals(HOUR + 10L * 360, tsdb.partitionOf(routing).expiresAt(keys.indexKey()));
        assertEquals(HOUR + 10L * 360, tsdb.partitionOf(routing).expiresAt(keys.sketchKey()));
    }

    @Test
    void merge_imports_sources_and_clears_them() {
        store.record(M, request(3, "a", 2, "b", 1), at(HOUR), null);
        store.record(M, request(4, "a", 1), at(HOUR), null);
        store.record(M, request(9, "a", 1, "c", 7), at(HOUR), null);

        WriteOutcome outcome = store.merge(M, EntityKey.of(9), List.of(EntityKey.of(3), EntityKey.of(4)), null, null);

        assertTrue(outcome.isDelivered());
        assertEquals(List.of(new RankedMember("c", 7), new RankedMember("a", 4), new RankedMember("b", 1)), ranked(9, null));
        assertEquals(List.of(), ranked(3, null));
        assertEquals(List.of(), ranked(4, null));
    }

    @Test
    void delete_removes_index_and_sketch() {
        store.record(M, request(1, "a", 1), at(HOUR), null);

        store.delete(List.of(M), List.of(EntityKey.of(1)), null, null, null, null);

        assertEquals(List.of(), ranked(1, null));
        assertTrue(tsdb.allKeys().isEmpty());
    }

    @Test
    void weights_must_be_positive() {
        assertThrows(ValidationException.class, () -> store.record(M, request(1, "a", 0), at(HOUR), null));
        assertTrue(tsdb.allKeys().isEmpty());
    }

    @Test
    void disabled_sketches_ignore_writes_and_reject_queries() {
        FrequencySketchStoreImpl disabled = tsdb.frequencyStore(5, false);

        WriteOutcome outcome = disabled.record(M, request(1, "a", 1), at(HOUR), null);
        assertTrue(outcome.isDelivered());
        assertTrue(disabled.merge(M, EntityKey.of(9), List.of(EntityKey.of(1)), null, null).isDelivered());
        assertTrue(tsdb.allKeys().isEmpty());

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> disabled.ranked(M, List.of(EntityKey.of(1)), at(HOUR), at(HOUR), 3600, null, null));
        assertEquals(ErrorCode.SKETCHES_DISABLED, ex.getErrorCode());
        assertThrows(ConfigurationException.class,
                () -> disabled.totals(M, Map.of(EntityKey.of(1), List.of("a")), at(HOUR), at(HOUR), 3600, null));
    }
}
