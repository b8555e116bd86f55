package com.tongji.tsdb.distinct.model;

import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.TsdbModel;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 一条去重计数写入：把 values 加入实体的 HyperLogLog。
 * @param timestamp 为空表示当前时间
 * @param dimensionId 为空表示只写聚合视图
 */
public record DistinctRecord(TsdbModel model, EntityKey key, Collection<String> values, Instant timestamp,
                             Long dimensionId) {

    public DistinctRecord {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
