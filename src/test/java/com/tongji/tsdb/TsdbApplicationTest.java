package com.tongji.tsdb;

import com.tongji.tsdb.counter.service.CounterStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "tsdb.clusters.default.backend=memory")
class TsdbApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void no_default_redis_connection_is_created() {
        assertTrue(context.getBeansOfType(RedisConnectionFactory.class).isEmpty());
        assertTrue(context.getBeansOfType(StringRedisTemplate.class).isEmpty());
        assertNotNull(context.getBean(CounterStore.class));
    }
}
