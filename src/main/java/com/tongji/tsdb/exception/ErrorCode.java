package com.tongji.tsdb.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    INVALID_ARGUMENT("INVALID_ARGUMENT", "请求参数错误"),
    MODEL_KIND_MISMATCH("MODEL_KIND_MISMATCH", "模型类型与存储不匹配"),
    DIMENSION_NOT_SUPPORTED("DIMENSION_NOT_SUPPORTED", "该模型不支持维度"),
    MULTIPLE_DIMENSION_FILTERS("MULTIPLE_DIMENSION_FILTERS", "不支持同时按多个维度过滤"),
    UNKNOWN_ROLLUP("UNKNOWN_ROLLUP", "未配置的聚合粒度"),
    UNKNOWN_CLUSTER("UNKNOWN_CLUSTER", "未定义的集群"),
    SKETCHES_DISABLED("SKETCHES_DISABLED", "频次草图功能未启用"),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "存储分区不可用"),
    COMMAND_REJECTED("COMMAND_REJECTED", "存储拒绝执行命令");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
