package com.tongji.tsdb.schema;

import com.tongji.tsdb.model.EntityKey;
import com.tongji.tsdb.model.TsdbModel;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Redis Key 生成工具（纯函数，相同输入恒得相同输出）。
 *
 * <p>格式：</p>
 * - 存储键：{prefix}{model}:{rollup}:{epoch}:{entity}[?d={dimension}]
 * - 计数分片键：{prefix}{model}:{rollup}:{epoch}:{vnode}，field = {entity}[?d={dimension}]
 * - 频次表：存储键 + ":i" / ":e"
 *
 * <p>只有 prefix 与 vnodes 两个部署常量会改变输出；vnodes 变更会使全部既有分片失效。</p>
 */
public final class KeyCodec {

    private static final String DIMENSION_SEPARATOR = "?d=";

    private final String prefix;
    private final int vnodes;

    public KeyCodec(String prefix, int vnodes) {
        if (vnodes < 1) {
            throw new IllegalArgumentException("vnodes must be positive");
        }
        this.prefix = prefix;
        this.vnodes = vnodes;
    }

    /**
     * 归一化到所在粒度桶的起始时间。
     * @param timestamp 秒级时间戳
     * @param rollup 粒度（秒）
     */
    public static long epoch(long timestamp, int rollup) {
        return Math.floorDiv(timestamp, rollup) * rollup;
    }

    /**
     * 实体键归一化：整数原样保留（Redis 对纯整数字段有更紧凑的编码），
     * 字符串取 UTF-8 的 MD5 十六进制摘要，保证键长有界。
     */
    public String modelKey(EntityKey key) {
        if (key.isNumeric()) {
            return String.valueOf(key.id());
        }
        return DigestUtils.md5DigestAsHex(key.name().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 虚拟分片：整数键取模，字符串键用 CRC32（跨进程、跨重启稳定，不依赖 hashCode）。
     */
    public int vnode(EntityKey key) {
        if (key.isNumeric()) {
            return (int) Math.floorMod(key.id(), (long) vnodes);
        }
        CRC32 crc = new CRC32();
        crc.update(key.name().getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % vnodes);
    }

    public String makeKey(TsdbModel model, int rollup, long timestamp, EntityKey key, Long dimensionId) {
        return seriesPrefix(model, rollup, timestamp) + modelKey(key) + dimensionSuffix(dimensionId);
    }

    public CounterKey makeCounterKey(TsdbModel model, int rollup, long timestamp, EntityKey key, Long dimensionId) {
        String hashKey = seriesPrefix(model, rollup, timestamp) + vnode(key);
        return new CounterKey(hashKey, modelKey(key) + dimensionSuffix(dimensionId));
    }

    public FrequencyTableKeys makeFrequencyTableKeys(TsdbModel model, int rollup, long timestamp,
                                                     EntityKey key, Long dimensionId) {
        String base = makeKey(model, rollup, timestamp, key, dimensionId);
        return new FrequencyTableKeys(base + ":i", base + ":e");
    }

    /**
     * 路由键：同一实体的所有频次表（各粒度、各桶）落在同一分区，便于单脚本原子处理。
     */
    public String routingKey(TsdbModel model, EntityKey key) {
        return prefix + model.getId() + ":" + modelKey(key);
    }

    /**
     * 跨分区归并使用的临时键：{prefix}tmp:{operationId}:{suffix}
     */
    public String temporaryKey(String operationId, String suffix) {
        return prefix + "tmp:" + operationId + ":" + suffix;
    }

    public int getVnodes() {
        return vnodes;
    }

    private String seriesPrefix(TsdbModel model, int rollup, long timestamp) {
        return prefix + model.getId() + ":" + rollup + ":" + epoch(timestamp, rollup) + ":";
    }

    private static String dimensionSuffix(Long dimensionId) {
        return dimensionId == null ? "" : DIMENSION_SEPARATOR + dimensionId;
    }
}
