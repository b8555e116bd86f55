package com.tongji.tsdb.cluster;

import com.tongji.tsdb.config.TsdbProperties;
import com.tongji.tsdb.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 持久性策略：决定分区故障是抛给调用方还是记录后丢弃。
 *
 * <p>规则：</p>
 * - 写：持久路由原样抛出 {@link StoreUnavailableException}；非持久路由记 WARN 并返回带 suppressed 的结果；
 * - 读：默认返回零值/空结果（尽力而为），可配置为直接抛出；
 * - 只处理分区不可用，校验与配置错误一律照常抛出。
 */
@Slf4j
public class DurabilityGuard {

    private final TsdbProperties.ReadFailure readFailure;

    public DurabilityGuard(TsdbProperties.ReadFailure readFailure) {
        this.readFailure = readFailure;
    }

    public WriteOutcome write(Route route, Runnable action) {
        try {
            action.run();
            return WriteOutcome.delivered();
        } catch (StoreUnavailableException ex) {
            if (route.durable()) {
                throw ex;
            }
            log.warn("Write dropped on non-durable cluster={} partition={}: {}",
                    route.cluster().name(), ex.getPartition(), ex.getMessage());
            return WriteOutcome.suppressed(ex);
        }
    }

    public <T> T read(Supplier<T> action, Supplier<T> fallback) {
        try {
            return action.get();
        } catch (StoreUnavailableException ex) {
            if (readFailure == TsdbProperties.ReadFailure.PROPAGATE) {
                throw ex;
            }
            log.warn("Read failed on partition={}, returning empty result: {}", ex.getPartition(), ex.getMessage());
            return fallback.get();
        }
    }
}
