package com.tongji.tsdb.rollup;

import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RollupSchedulerTest {

    private static final long HOUR = 1_699_999_200L;

    private final RollupScheduler scheduler = new RollupScheduler(rollups(), 360,
            Clock.fixed(Instant.ofEpochSecond(HOUR), ZoneOffset.UTC));

    private static Map<Integer, Integer> rollups() {
        Map<Integer, Integer> rollups = new LinkedHashMap<>();
        rollups.put(3600, 168);
        rollups.put(10, 360);
        return rollups;
    }

    @Test
    void rollups_are_ordered_fine_to_coarse() {
        assertEquals(List.of(10, 3600), List.copyOf(scheduler.getRollups().keySet()));
    }

    @Test
    void series_covers_closed_interval() {
        RollupSeries series = scheduler.series(Instant.ofEpochSecond(HOUR + 5), Instant.ofEpochSecond(HOUR + 30), 10);

        assertEquals(10, series.rollup());
        assertEquals(List.of(HOUR, HOUR + 10, HOUR + 20, HOUR + 30), series.epochs());
    }

    @Test
    void series_end_defaults_to_now() {
        RollupSeries series = scheduler.series(Instant.ofEpochSecond(HOUR - 20), null, 10);

        assertEquals(List.of(HOUR - 20, HOUR - 10, HOUR), series.epochs());
    }

    @Test
    void optimal_rollup_respects_point_budget() {
        assertEquals(10, scheduler.optimalRollup(HOUR, HOUR + 3600));
        assertEquals(3600, scheduler.optimalRollup(HOUR, HOUR + 3601));
        // nothing fits: coarsest wins
        assertEquals(3600, scheduler.optimalRollup(HOUR, HOUR + 3600L * 1000));

        RollupSeries auto = scheduler.series(Instant.ofEpochSecond(HOUR), Instant.ofEpochSecond(HOUR + 7200), null);
        assertEquals(3600, auto.rollup());
        assertEquals(3, auto.epochs().size());
    }

    @Test
    void unknown_rollup_is_a_configuration_error() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> scheduler.series(Instant.ofEpochSecond(HOUR), Instant.ofEpochSecond(HOUR), 60));
        assertEquals(ErrorCode.UNKNOWN_ROLLUP, ex.getErrorCode());
        assertThrows(ConfigurationException.class, () -> scheduler.retention(60));
    }

    @Test
    void invalid_registry_fails_fast() {
        Clock clock = Clock.systemUTC();
        assertThrows(ConfigurationException.class, () -> new RollupScheduler(Map.of(), 360, clock));
        assertThrows(ConfigurationException.class, () -> new RollupScheduler(Map.of(0, 10), 360, clock));
        assertThrows(ConfigurationException.class, () -> new RollupScheduler(Map.of(10, 0), 360, clock));
    }

    @Test
    void expiry_is_epoch_plus_retention_window() {
        assertEquals(HOUR + 3600L * 168, scheduler.calculateExpiry(3600, 168, HOUR + 1234));
        assertEquals(HOUR + 3600L * 168, scheduler.calculateExpiry(3600, HOUR + 3599));
        assertEquals(HOUR + 10L * 360, scheduler.calculateExpiry(10, HOUR + 9));
    }

    @Test
    void expiry_never_decreases_within_an_epoch() {
        long previous = Long.MIN_VALUE;
        for (long ts = HOUR; ts < HOUR + 3600; ts += 97) {
            long expiry = scheduler.calculateExpiry(3600, ts);
            assertTrue(expiry >= previous);
            previous = expiry;
        }
    }

    @Test
    void active_series_spans_each_rollups_retention() {
        Map<Integer, List<Long>> active = scheduler.activeSeries(null, null, Instant.ofEpochSecond(HOUR));

        assertEquals(360, active.get(10).size());
        assertEquals(HOUR - 10L * 359, active.get(10).get(0));
        assertEquals(HOUR, active.get(10).get(359));
        assertEquals(168, active.get(3600).size());
        assertEquals(HOUR - 3600L * 167, active.get(3600).get(0));
    }

    @Test
    void active_series_honours_explicit_bounds() {
        Map<Integer, List<Long>> active = scheduler.activeSeries(
                Instant.ofEpochSecond(HOUR), Instant.ofEpochSecond(HOUR + 20), null);

        assertEquals(List.of(HOUR, HOUR + 10, HOUR + 20), active.get(10));
        assertEquals(List.of(HOUR), active.get(3600));
    }
}
