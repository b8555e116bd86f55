package com.tongji.tsdb.cluster;

import com.tongji.tsdb.store.ClusterGroup;

/**
 * 路由结果：目标集群 + 持久性分级。
 * @param durable 为 true 时写失败向调用方抛出，否则记录后丢弃
 */
public record Route(ClusterGroup cluster, boolean durable) {
}
