package com.tongji.tsdb.store.redis;

import com.tongji.tsdb.store.PartitionCommands;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.ReturnType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 管道模式下的线协议实现：每个方法只向当前连接入队一条命令。
 *
 * <p>管道关闭时状态回复（OK）会被丢弃，导致结果与命令错位；因此 PFMERGE 与 SET
 * 经脚本执行并返回整数，保证每条命令恰好产生一个结果。</p>
 */
final class RedisPartitionCommands implements PartitionCommands {

    // Redis 内嵌 Lua：原子读取并删除 Hash 字段
    static final String HASH_TAKE_LUA = """
            local v = redis.call('HGET', KEYS[1], ARGV[1])
            if v then
              redis.call('HDEL', KEYS[1], ARGV[1])
            end
            return v
            """;

    // 饱和累加：HINCRBY 溢出时把字段置为 LLONG_MAX；返回字段文本（Lua 数字为双精度，不能直接返回大整数）
    static final String HASH_INCR_SATURATED_LUA = """
            local r = redis.pcall('HINCRBY', KEYS[1], ARGV[1], ARGV[2])
            if type(r) == 'table' and r.err then
              if string.find(r.err, 'overflow', 1, true) then
                redis.call('HSET', KEYS[1], ARGV[1], '9223372036854775807')
              else
                return r
              end
            end
            return redis.call('HGET', KEYS[1], ARGV[1])
            """;

    static final String PFMERGE_LUA = """
            redis.call('PFMERGE', unpack(KEYS))
            return 1
            """;

    static final String SET_EX_LUA = """
            redis.call('SET', KEYS[1], ARGV[1], 'EX', ARGV[2])
            return 1
            """;

    private final RedisConnection connection;
    private final byte[] countMinScript;

    RedisPartitionCommands(RedisConnection connection, byte[] countMinScript) {
        this.connection = connection;
        this.countMinScript = countMinScript;
    }

    @Override
    public Object hincrBy(String key, String field, long delta) {
        return connection.scriptingCommands().eval(bytes(HASH_INCR_SATURATED_LUA), ReturnType.VALUE, 1,
                bytes(key), bytes(field), bytes(String.valueOf(delta)));
    }

    @Override
    public Object hget(String key, String field) {
        return connection.hashCommands().hGet(bytes(key), bytes(field));
    }

    @Override
    public Object hdel(String key, String... fields) {
        return connection.hashCommands().hDel(bytes(key), bytes(fields));
    }

    @Override
    public Object hashTake(String key, String field) {
        return connection.scriptingCommands().eval(bytes(HASH_TAKE_LUA), ReturnType.VALUE, 1, bytes(key), bytes(field));
    }

    @Override
    public Object expireAt(String key, long unixSeconds) {
        return connection.keyCommands().expireAt(bytes(key), unixSeconds);
    }

    @Override
    public Object del(String... keys) {
        return connection.keyCommands().del(bytes(keys));
    }

    @Override
    public Object pfadd(String key, String... values) {
        return connection.hyperLogLogCommands().pfAdd(bytes(key), bytes(values));
    }

    @Override
    public Object pfcount(String... keys) {
        return connection.hyperLogLogCommands().pfCount(bytes(keys));
    }

    @Override
    public Object pfmerge(String destination, String... sources) {
        byte[][] keys = new byte[sources.length + 1][];
        keys[0] = bytes(destination);
        for (int i = 0; i < sources.length; i++) {
            keys[i + 1] = bytes(sources[i]);
        }
        return connection.scriptingCommands().eval(bytes(PFMERGE_LUA), ReturnType.INTEGER, keys.length, keys);
    }

    @Override
    public Object get(String key) {
        return connection.stringCommands().get(bytes(key));
    }

    @Override
    public Object setWithTtl(String key, byte[] value, long ttlSeconds) {
        return connection.scriptingCommands().eval(bytes(SET_EX_LUA), ReturnType.INTEGER, 1,
                bytes(key), value, bytes(String.valueOf(ttlSeconds)));
    }

    @Override
    public Object countMin(List<String> keys, List<String> arguments) {
        List<String> keysAndArgs = new ArrayList<>(keys.size() + arguments.size());
        keysAndArgs.addAll(keys);
        keysAndArgs.addAll(arguments);
        return connection.scriptingCommands().eval(countMinScript, ReturnType.MULTI, keys.size(),
                bytes(keysAndArgs.toArray(new String[0])));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[][] bytes(String[] values) {
        byte[][] out = new byte[values.length][];
        for (int i = 0; i < values.length; i++) {
            out[i] = bytes(values[i]);
        }
        return out;
    }
}
