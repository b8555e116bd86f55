package com.tongji.tsdb.exception;

/**
 * 调用方传入了不支持的参数组合，在任何网络调用之前同步抛出，不应重试。
 */
public class ValidationException extends TsdbException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
