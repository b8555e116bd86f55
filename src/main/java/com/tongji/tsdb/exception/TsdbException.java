package com.tongji.tsdb.exception;

import lombok.Getter;

/**
 * 时序引擎异常基类，携带错误码。
 * <p>
 * 所有异常均只作用于触发它的那一次操作，本层不做自动重试。
 */
@Getter
public class TsdbException extends RuntimeException {

    private final ErrorCode errorCode;

    public TsdbException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public TsdbException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TsdbException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
