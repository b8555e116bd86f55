package com.tongji.tsdb.exception;

/**
 * 分区网络故障、超时或宕机。
 * <p>
 * 持久路由上原样抛给调用方；非持久路由上由 {@code DurabilityGuard} 吞掉并记录到写入结果中。
 */
public class StoreUnavailableException extends TsdbException {

    private final String partition;

    public StoreUnavailableException(String partition, String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
        this.partition = partition;
    }

    public StoreUnavailableException(String partition, String message) {
        this(partition, message, null);
    }

    public String getPartition() {
        return partition;
    }
}
