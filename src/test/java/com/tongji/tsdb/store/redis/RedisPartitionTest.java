package com.tongji.tsdb.store.redis;

import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.StoreUnavailableException;
import com.tongji.tsdb.exception.TsdbException;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisPipelineException;

import static org.junit.jupiter.api.Assertions.*;

class RedisPartitionTest {

    @Test
    void connection_failures_mean_the_partition_is_unavailable() {
        TsdbException ex = RedisPartition.translate("redis-0", new RedisConnectionFailureException("refused"));

        StoreUnavailableException unavailable = assertInstanceOf(StoreUnavailableException.class, ex);
        assertEquals("redis-0", unavailable.getPartition());
        assertEquals(ErrorCode.STORE_UNAVAILABLE, unavailable.getErrorCode());
    }

    @Test
    void timeouts_mean_the_partition_is_unavailable() {
        assertInstanceOf(StoreUnavailableException.class,
                RedisPartition.translate("redis-0", new QueryTimeoutException("slow")));
        assertInstanceOf(StoreUnavailableException.class, RedisPartition.translate("redis-0",
                new RedisPipelineException(new RedisCommandTimeoutException("Command timed out"))));
    }

    @Test
    void lettuce_connection_errors_are_found_in_the_cause_chain() {
        RedisSystemException wrapped = new RedisSystemException("pipeline aborted",
                new RedisConnectionException("Connection closed"));

        assertInstanceOf(StoreUnavailableException.class, RedisPartition.translate("redis-0", wrapped));
    }

    @Test
    void server_rejections_are_not_treated_as_outages() {
        RedisPipelineException scriptError = new RedisPipelineException(
                new RedisCommandExecutionException("ERR user_script:1: Script attempted to access nonexistent global"));

        TsdbException ex = RedisPartition.translate("redis-0", scriptError);

        assertFalse(ex instanceof StoreUnavailableException);
        assertEquals(ErrorCode.COMMAND_REJECTED, ex.getErrorCode());
        assertSame(scriptError, ex.getCause());
    }
}
