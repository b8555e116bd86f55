package com.tongji.tsdb.model;

import java.time.Instant;

/**
 * 时间序列上的一个点：桶起始时间 + 值。
 */
public record Point<V>(Instant timestamp, V value) {

    public static <V> Point<V> of(long epochSecond, V value) {
        return new Point<>(Instant.ofEpochSecond(epochSecond), value);
    }
}
