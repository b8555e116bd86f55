package com.tongji.tsdb.rollup;

import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.schema.KeyCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 聚合粒度注册表与时间序列展开。
 *
 * <p>职责：</p>
 * - 持有粒度（秒）→ 保留样本数的不可变映射，按粒度从细到粗排序；
 * - 展开 [start, end] 闭区间覆盖的桶；未指定粒度时按点数预算挑选最细可用粒度；
 * - 计算过期时间：epoch + rollup × samples。
 */
public class RollupScheduler {

    private final NavigableMap<Integer, Integer> rollups;
    private final int maxPoints;
    private final Clock clock;

    public RollupScheduler(Map<Integer, Integer> rollups, int maxPoints, Clock clock) {
        if (rollups == null || rollups.isEmpty()) {
            throw new ConfigurationException(ErrorCode.UNKNOWN_ROLLUP, "至少需要配置一个聚合粒度");
        }
        TreeMap<Integer, Integer> sorted = new TreeMap<>();
        rollups.forEach((window, samples) -> {
            if (window == null || window <= 0 || samples == null || samples <= 0) {
                throw new ConfigurationException(ErrorCode.UNKNOWN_ROLLUP,
                        "非法的聚合粒度配置: %s -> %s".formatted(window, samples));
            }
            sorted.put(window, samples);
        });
        this.rollups = Collections.unmodifiableNavigableMap(sorted);
        this.maxPoints = maxPoints;
        this.clock = clock;
    }

    /** 粒度 → 保留样本数（细到粗）。 */
    public NavigableMap<Integer, Integer> getRollups() {
        return rollups;
    }

    public int retention(int rollup) {
        Integer samples = rollups.get(rollup);
        if (samples == null) {
            throw new ConfigurationException(ErrorCode.UNKNOWN_ROLLUP,
                    "未配置的聚合粒度: %d 秒".formatted(rollup));
        }
        return samples;
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }

    /**
     * 最优粒度：满足 ceil((end-start)/window) <= maxPoints 的最细粒度；都不满足时取最粗粒度。
     */
    public int optimalRollup(long start, long end) {
        long span = Math.max(0L, end - start);
        for (int window : rollups.keySet()) {
            long points = (span + window - 1) / window;
            if (points <= maxPoints) {
                return window;
            }
        }
        return rollups.lastKey();
    }

    /**
     * 展开 [start, end] 闭区间在给定粒度下的全部桶。
     * @param rollup 为 null 时自动挑选最优粒度
     */
    public RollupSeries series(Instant start, Instant end, Integer rollup) {
        long from = start.getEpochSecond();
        long to = end == null ? now() : end.getEpochSecond();
        int window = rollup == null ? optimalRollup(from, to) : rollup;
        retention(window);
        List<Long> epochs = new ArrayList<>();
        if (from <= to) {
            for (long epoch = KeyCodec.epoch(from, window); epoch <= to; epoch += window) {
                epochs.add(epoch);
            }
        }
        return new RollupSeries(window, epochs);
    }

    /**
     * 所有粒度下仍可能被查询到的桶（合并、删除使用）。
     * start 缺省时取 timestamp 往前推 rollup × (samples - 1)，即该粒度最早未过期的桶。
     */
    public Map<Integer, List<Long>> activeSeries(Instant start, Instant end, Instant timestamp) {
        Instant reference = timestamp == null ? clock.instant() : timestamp;
        Map<Integer, List<Long>> active = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> e : rollups.entrySet()) {
            int rollup = e.getKey();
            Instant from = start != null ? start : Instant.ofEpochSecond(earliestTimestamp(rollup, reference));
            Instant to = end != null ? end : reference;
            active.put(rollup, series(from, to, rollup).epochs());
        }
        return active;
    }

    public long earliestTimestamp(int rollup, Instant reference) {
        long lifespan = (long) rollup * (retention(rollup) - 1);
        return KeyCodec.epoch(reference.getEpochSecond() - lifespan, rollup);
    }

    public long calculateExpiry(int rollup, int samples, long timestamp) {
        return KeyCodec.epoch(timestamp, rollup) + (long) rollup * samples;
    }

    public long calculateExpiry(int rollup, long timestamp) {
        return calculateExpiry(rollup, retention(rollup), timestamp);
    }
}
