package com.tongji.tsdb.rollup;

import java.util.List;

/**
 * 一段查询区间在某粒度下展开的桶起始时间（升序）。
 */
public record RollupSeries(int rollup, List<Long> epochs) {

    public RollupSeries {
        epochs = List.copyOf(epochs);
    }
}
