package com.tongji.tsdb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 时序引擎配置属性，绑定前缀 {@code tsdb.*}。
 *
 * <p>包含以下分组：</p>
 * - 键空间：前缀、vnode 数量（部署常量，变更需全量迁移）；
 * - Rollups：聚合粒度（秒）→ 保留样本数；
 * - Sketch：频次草图开关与形状参数；
 * - Clusters / Routing：分区拓扑、持久性分级与维度路由。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "tsdb")
public class TsdbProperties {

    /** 所有物理键的前缀。 */
    @NotBlank
    private String prefix = "ts:";
    /** 计数 Hash 的虚拟分片数量，上线后不可修改。 */
    @Min(1)
    private int vnodes = 64;
    /** 未指定粒度时单次查询允许的最大点数。 */
    @Min(1)
    private int maxPoints = 360;
    /** 聚合粒度（秒）→ 保留样本数；为空时使用默认粒度。 */
    private Map<Integer, Integer> rollups = new LinkedHashMap<>();
    /** 读失败策略：默认返回空/零值。 */
    @NotNull
    private ReadFailure readFailure = ReadFailure.SUPPRESS;
    /** 跨分区合并时临时键的兜底 TTL。 */
    @NotNull
    private Duration temporaryKeyTtl = Duration.ofMinutes(1);
    /** 并发派发分区管道的线程数。 */
    @Min(1)
    private int pipelineThreads = 8;

    @Valid
    private final Sketch sketch = new Sketch();
    @Valid
    private final Memory memory = new Memory();
    @Valid
    private final Routing routing = new Routing();
    /** 集群名 → 集群定义。 */
    @NotEmpty
    @Valid
    private Map<String, Cluster> clusters = new LinkedHashMap<>();

    /**
     * 生效的粒度配置。绑定器会把配置合并进字段的初始值，因此默认值不放在字段上。
     */
    public Map<Integer, Integer> resolvedRollups() {
        return rollups.isEmpty() ? defaultRollups() : rollups;
    }

    private static Map<Integer, Integer> defaultRollups() {
        Map<Integer, Integer> rollups = new LinkedHashMap<>();
        rollups.put(10, 360);       // 10 秒粒度保留 1 小时
        rollups.put(3600, 24 * 7);  // 1 小时粒度保留 7 天
        return rollups;
    }

    public enum ReadFailure { SUPPRESS, PROPAGATE }

    public enum Backend { REDIS, MEMORY }

    /** 频次草图配置。 */
    @Data
    public static class Sketch {
        /** 是否启用频次草图（按部署开启）。 */
        private boolean enabled = true;
        /** 草图深度（哈希行数），单个 SHA-1 摘要最多切出 5 行。 */
        @Min(1)
        @Max(5)
        private int depth = 3;
        /** 草图宽度（每行计数器个数）。 */
        @Min(1)
        private int width = 128;
        /** 精确排行索引容量。 */
        @Min(1)
        private int capacity = 50;
    }

    /** 内存后端配置（本地开发与测试）。 */
    @Data
    public static class Memory {
        /** HyperLogLog 精度 log2(K)，14 对应约 0.8% 的相对标准误差。 */
        @Min(4)
        @Max(21)
        private int hllLgK = 14;
    }

    /** 维度路由配置。 */
    @Data
    public static class Routing {
        /** 聚合视图（无维度）写入的集群。 */
        @NotBlank
        private String aggregateCluster = "default";
        /** 维度叠加视图写入的集群。 */
        @NotBlank
        private String dimensionCluster = "default";
        /** 个别维度的专属集群。 */
        private Map<Long, String> dimensionOverrides = new HashMap<>();
    }

    /** 集群定义：一组分区 + 持久性分级。 */
    @Data
    public static class Cluster {
        @NotNull
        private Backend backend = Backend.REDIS;
        /** 持久集群写失败向调用方抛出；非持久集群写失败静默丢弃。 */
        private boolean durable = true;
        /** 单条命令超时。 */
        @NotNull
        private Duration commandTimeout = Duration.ofSeconds(2);
        @NotEmpty
        @Valid
        private List<Node> partitions = new ArrayList<>();
    }

    /** 单个分区（一个 Redis 实例）。 */
    @Data
    public static class Node {
        @NotBlank
        private String name;
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
    }
}
