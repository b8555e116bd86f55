package com.tongji.tsdb.model;

import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.ValidationException;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 时序模型枚举（封闭集合）。
 *
 * <p>id 会写入存储键，上线后不可修改；类加载时校验 id 唯一，重复配置直接启动失败。</p>
 */
@Getter
public enum TsdbModel {
    // 计数模型 1~199
    PROJECT(1, ModelKind.COUNTER, true),
    GROUP(4, ModelKind.COUNTER, true),
    RELEASE(7, ModelKind.COUNTER, true),
    PROJECT_TOTAL_RECEIVED(100, ModelKind.COUNTER, false),
    PROJECT_TOTAL_REJECTED(101, ModelKind.COUNTER, false),
    PROJECT_TOTAL_BLACKLISTED(102, ModelKind.COUNTER, false),

    // 去重计数模型 300~399
    USERS_AFFECTED_BY_GROUP(300, ModelKind.DISTINCT, true),
    USERS_AFFECTED_BY_PROJECT(301, ModelKind.DISTINCT, true),

    // 频次模型 400~499
    FREQUENT_ENVIRONMENTS_BY_GROUP(404, ModelKind.FREQUENCY, false),
    FREQUENT_RELEASES_BY_GROUP(406, ModelKind.FREQUENCY, true),
    FREQUENT_ISSUES_BY_PROJECT(407, ModelKind.FREQUENCY, true);

    private static final Map<Integer, TsdbModel> BY_ID;

    static {
        Map<Integer, TsdbModel> byId = new HashMap<>();
        for (TsdbModel model : values()) {
            TsdbModel previous = byId.put(model.id, model);
            if (previous != null) {
                throw new IllegalStateException("Duplicate model id " + model.id + ": " + previous + ", " + model);
            }
        }
        BY_ID = Collections.unmodifiableMap(byId);
    }

    private final int id;
    private final ModelKind kind;
    /** 是否允许按维度（环境）写入叠加视图 */
    private final boolean supportsDimensions;

    TsdbModel(int id, ModelKind kind, boolean supportsDimensions) {
        this.id = id;
        this.kind = kind;
        this.supportsDimensions = supportsDimensions;
    }

    public static TsdbModel fromId(int id) {
        TsdbModel model = BY_ID.get(id);
        if (model == null) {
            throw new IllegalArgumentException("Unknown model id " + id);
        }
        return model;
    }

    /**
     * 校验模型类型与维度组合，在发起任何网络调用前执行。
     * @param kind 调用方所在 Store 的类型
     * @param dimensionIds 本次涉及的维度（可包含 null，表示聚合视图）
     */
    public void validate(ModelKind kind, Collection<Long> dimensionIds) {
        if (this.kind != kind) {
            throw new ValidationException(ErrorCode.MODEL_KIND_MISMATCH,
                    "模型 %s 的类型为 %s，不能用于 %s".formatted(name(), this.kind, kind));
        }
        if (!supportsDimensions && dimensionIds != null
                && dimensionIds.stream().anyMatch(Objects::nonNull)) {
            throw new ValidationException(ErrorCode.DIMENSION_NOT_SUPPORTED,
                    "模型 %s 不支持维度写入或查询".formatted(name()));
        }
    }
}
