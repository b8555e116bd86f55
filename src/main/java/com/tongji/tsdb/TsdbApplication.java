package com.tongji.tsdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;

/**
 * 每个分区自建 Lettuce 连接，不使用 Spring Boot 默认的单实例 Redis 连接。
 */
@SpringBootApplication(exclude = RedisAutoConfiguration.class)
public class TsdbApplication {

    public static void main(String[] args) {
        SpringApplication.run(TsdbApplication.class, args);
    }
}
