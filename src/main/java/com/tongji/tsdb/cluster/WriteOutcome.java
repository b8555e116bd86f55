package com.tongji.tsdb.cluster;

import com.tongji.tsdb.exception.StoreUnavailableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 写入结果。
 * <p>
 * 非持久路由上的失败不会抛出，而是作为 suppressed 记录在这里：调用方拿到的
 * “正常返回”可能意味着部分数据已被丢弃，需要时应检查 {@link #isDelivered()}。
 */
public final class WriteOutcome {

    private static final WriteOutcome DELIVERED = new WriteOutcome(List.of());

    private final List<StoreUnavailableException> suppressed;

    private WriteOutcome(List<StoreUnavailableException> suppressed) {
        this.suppressed = suppressed;
    }

    public static WriteOutcome delivered() {
        return DELIVERED;
    }

    public static WriteOutcome suppressed(StoreUnavailableException failure) {
        return new WriteOutcome(List.of(failure));
    }

    public WriteOutcome and(WriteOutcome other) {
        if (other.suppressed.isEmpty()) {
            return this;
        }
        if (suppressed.isEmpty()) {
            return other;
        }
        List<StoreUnavailableException> all = new ArrayList<>(suppressed);
        all.addAll(other.suppressed);
        return new WriteOutcome(Collections.unmodifiableList(all));
    }

    public boolean isDelivered() {
        return suppressed.isEmpty();
    }

    public List<StoreUnavailableException> getSuppressed() {
        return suppressed;
    }

    @Override
    public String toString() {
        return isDelivered() ? "WriteOutcome[delivered]" : "WriteOutcome[suppressed=" + suppressed.size() + "]";
    }
}
