package com.tongji.tsdb.cluster;

import com.tongji.tsdb.exception.ConfigurationException;
import com.tongji.tsdb.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 维度 → 集群路由。
 *
 * <p>聚合视图（维度为 null）与维度叠加视图可分别落在不同集群，个别维度可单独指定集群；
 * 每个集群自带持久性分级。</p>
 */
@Slf4j
public class ClusterRouter implements AutoCloseable {

    private final Map<String, Route> routes;
    private final Route aggregate;
    private final Route dimension;
    private final Map<Long, Route> overrides = new LinkedHashMap<>();

    public ClusterRouter(Map<String, Route> routes, String aggregateCluster, String dimensionCluster,
                         Map<Long, String> dimensionOverrides) {
        this.routes = Map.copyOf(routes);
        this.aggregate = require(aggregateCluster);
        this.dimension = require(dimensionCluster);
        if (dimensionOverrides != null) {
            dimensionOverrides.forEach((dimensionId, cluster) -> overrides.put(dimensionId, require(cluster)));
        }
    }

    /**
     * @param dimensionId null 表示聚合视图
     */
    public Route route(Long dimensionId) {
        if (dimensionId == null) {
            return aggregate;
        }
        return overrides.getOrDefault(dimensionId, dimension);
    }

    /**
     * 按路由归组一批维度（可包含 null），保持首次出现的顺序。
     */
    public Map<Route, List<Long>> routeAll(Collection<Long> dimensionIds) {
        Map<Route, List<Long>> groups = new LinkedHashMap<>();
        for (Long dimensionId : dimensionIds) {
            groups.computeIfAbsent(route(dimensionId), r -> new ArrayList<>()).add(dimensionId);
        }
        return groups;
    }

    public Collection<Route> routes() {
        return routes.values();
    }

    @Override
    public void close() {
        for (Route route : routes.values()) {
            route.cluster().close();
        }
        log.info("Cluster router closed clusters={}", routes.keySet());
    }

    private Route require(String cluster) {
        Route route = routes.get(cluster);
        if (route == null) {
            throw new ConfigurationException(ErrorCode.UNKNOWN_CLUSTER, "未定义的集群: " + cluster);
        }
        return route;
    }
}
