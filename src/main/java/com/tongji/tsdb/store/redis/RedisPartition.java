package com.tongji.tsdb.store.redis;

import com.tongji.tsdb.config.TsdbProperties;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.StoreUnavailableException;
import com.tongji.tsdb.exception.TsdbException;
import com.tongji.tsdb.frequency.schema.CountMinScript;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.StoreCommand;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * 单个 Redis 实例分区：一次 {@link #execute(List)} 对应一条管道、一次往返。
 */
@Slf4j
public class RedisPartition implements Partition {

    private static final byte[] COUNT_MIN_SCRIPT = CountMinScript.LUA.getBytes(StandardCharsets.UTF_8);

    private final String name;
    private final StringRedisTemplate redis;
    private final LettuceConnectionFactory connectionFactory;

    public RedisPartition(String name, StringRedisTemplate redis) {
        this(name, redis, null);
    }

    private RedisPartition(String name, StringRedisTemplate redis, LettuceConnectionFactory connectionFactory) {
        this.name = name;
        this.redis = redis;
        this.connectionFactory = connectionFactory;
    }

    /**
     * 按节点配置建立独立的 Lettuce 连接工厂（每个分区一个）。
     */
    public static RedisPartition connect(TsdbProperties.Node node, Duration commandTimeout) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(node.getHost(), node.getPort());
        standalone.setDatabase(node.getDatabase());
        if (node.getPassword() != null && !node.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(node.getPassword()));
        }
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .build();
        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, client);
        factory.afterPropertiesSet();
        factory.start();
        StringRedisTemplate template = new StringRedisTemplate(factory);
        template.afterPropertiesSet();
        log.info("Redis partition configured name={} host={} port={} db={}",
                node.getName(), node.getHost(), node.getPort(), node.getDatabase());
        return new RedisPartition(node.getName(), template, factory);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Object> execute(List<StoreCommand> commands) {
        if (commands.isEmpty()) {
            return List.of();
        }
        List<Object> raws;
        try {
            // 结果序列化器传 null：保留 byte[] 原始值（HyperLogLog 导出依赖原始字节）
            raws = redis.executePipelined((RedisCallback<Object>) connection -> {
                RedisPartitionCommands pipeline = new RedisPartitionCommands(connection, COUNT_MIN_SCRIPT);
                for (StoreCommand command : commands) {
                    command.issue(pipeline);
                }
                return null;
            }, null);
        } catch (DataAccessException ex) {
            throw translate(name, ex);
        }
        if (raws.size() != commands.size()) {
            throw new IllegalStateException("Pipeline on " + name + " returned " + raws.size()
                    + " results for " + commands.size() + " commands");
        }
        return raws;
    }

    /**
     * 只有连接失败与超时视为分区不可用；命令被服务端拒绝（脚本错误、WRONGTYPE 等）属于确定性错误，
     * 不能被持久性策略吞掉。
     */
    static TsdbException translate(String partition, DataAccessException ex) {
        if (isUnavailable(ex)) {
            log.debug("Pipeline failed partition={}", partition, ex);
            return new StoreUnavailableException(partition, "Redis pipeline failed on " + partition + ": " + ex.getMessage(), ex);
        }
        log.error("Redis rejected pipeline partition={}: {}", partition, ex.getMessage());
        return new TsdbException(ErrorCode.COMMAND_REJECTED,
                "Redis rejected a command on " + partition + ": " + ex.getMessage(), ex);
    }

    private static boolean isUnavailable(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof RedisConnectionFailureException
                    || cause instanceof QueryTimeoutException
                    || cause instanceof RedisConnectionException
                    || cause instanceof RedisCommandTimeoutException) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }
}
