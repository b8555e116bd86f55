package com.tongji.tsdb.store;

/**
 * 一条待入队的命令：对 {@link PartitionCommands} 恰好调用一次。
 */
@FunctionalInterface
public interface StoreCommand {

    Object issue(PartitionCommands commands);
}
