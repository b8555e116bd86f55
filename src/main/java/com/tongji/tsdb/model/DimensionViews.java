package com.tongji.tsdb.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 维度视图展开：每次写入同时落到维度叠加视图和聚合视图（维度为 null）。
 */
public final class DimensionViews {

    private DimensionViews() {}

    /** 单次写入涉及的视图：维度视图（若有）+ 聚合视图。 */
    public static List<Long> forWrite(Long dimensionId) {
        List<Long> views = new ArrayList<>(2);
        if (dimensionId != null) {
            views.add(dimensionId);
        }
        views.add(null);
        return views;
    }

    /** 合并、删除涉及的视图：给定维度 + 聚合视图，去重保序。 */
    public static Set<Long> withAggregate(Collection<Long> dimensionIds) {
        Set<Long> views = new LinkedHashSet<>();
        if (dimensionIds != null) {
            views.addAll(dimensionIds);
        }
        views.add(null);
        return views;
    }
}
