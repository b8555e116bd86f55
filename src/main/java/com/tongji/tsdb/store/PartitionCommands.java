package com.tongji.tsdb.store;

import java.util.List;

/**
 * 存储线协议：引擎对底层键值存储的全部要求。
 *
 * <p>每个方法恰好对应一条服务端命令。管道实现（Redis）在调用时只入队并返回 null，
 * 结果在管道关闭后按提交顺序收集；同步实现（内存）直接返回结果。调用方一律通过
 * {@link BatchResults} 读取结果，不依赖这里的返回值。</p>
 */
public interface PartitionCommands {

    /**
     * 非负计数累加，结果封顶到 {@link Long#MAX_VALUE}，不回绕也不报错。
     */
    Object hincrBy(String key, String field, long delta);

    Object hget(String key, String field);

    Object hdel(String key, String... fields);

    /** 原子读取并删除 Hash 字段（HGET + HDEL 不可分割）。 */
    Object hashTake(String key, String field);

    /** 设置绝对过期时间（秒级 Unix 时间戳）。 */
    Object expireAt(String key, long unixSeconds);

    Object del(String... keys);

    Object pfadd(String key, String... values);

    /** 多键时返回并集基数，要求所有键位于同一分区。 */
    Object pfcount(String... keys);

    /** 将 sources 并入 destination（destination 原有内容保留）。 */
    Object pfmerge(String destination, String... sources);

    /** 读取原始字节（HyperLogLog 的序列化形式即其原始值）。 */
    Object get(String key);

    Object setWithTtl(String key, byte[] value, long ttlSeconds);

    /**
     * 频次草图脚本：INCR / RANKED / ESTIMATE / EXPORT / IMPORT，服务端单次原子执行。
     * @param keys 成对出现的 (索引键, 草图键)
     * @param arguments 命令名、depth、width、capacity 及命令参数
     */
    Object countMin(List<String> keys, List<String> arguments);

    /** 非负数饱和加法：溢出时取 Long.MAX_VALUE。 */
    static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
