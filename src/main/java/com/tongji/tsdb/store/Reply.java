package com.tongji.tsdb.store;

import java.util.function.Function;

/**
 * 已入队命令的结果句柄；只有在 {@link ClusterGroup#await(Submission)} 之后才能通过
 * {@link BatchResults#get(Reply)} 取值。
 */
public record Reply<T>(Partition partition, int index, Function<Object, T> decoder) {
}
