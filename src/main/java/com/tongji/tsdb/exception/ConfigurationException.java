package com.tongji.tsdb.exception;

/**
 * 调用与部署配置不一致（未注册的粒度、功能未开启等），不是瞬时故障。
 */
public class ConfigurationException extends TsdbException {

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
