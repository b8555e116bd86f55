package com.tongji.tsdb.schema;

import java.util.List;

/**
 * 一张频次表的两个物理键：排行索引（:i，有序集合）与草图矩阵（:e，Hash）。
 */
public record FrequencyTableKeys(String indexKey, String sketchKey) {

    public List<String> asList() {
        return List.of(indexKey, sketchKey);
    }
}
