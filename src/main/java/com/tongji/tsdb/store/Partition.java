package com.tongji.tsdb.store;

import java.util.List;

/**
 * 物理分区（一个 Redis 实例或一个内存键空间）。
 */
public interface Partition extends AutoCloseable {

    String name();

    /**
     * 以一次管道执行命令；分区内按提交顺序执行。
     * @return 与 commands 一一对应的原始结果
     * @throws com.tongji.tsdb.exception.StoreUnavailableException 网络故障、超时或分区不可用
     * @throws com.tongji.tsdb.exception.TsdbException 命令被存储拒绝（COMMAND_REJECTED）
     */
    List<Object> execute(List<StoreCommand> commands);

    @Override
    default void close() {
    }
}
