package com.mcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * application.yml 中 mcache 前缀的配置
 */
@Data
@ConfigurationProperties(prefix = "mcache")
public class MCacheProperties {

    private Bloom bloom = new Bloom();

    private Cache cache = new Cache();

    @Data
    public static class Bloom {
        /* 位存储类型 */
        private BloomBackend backend = BloomBackend.LOCAL;
        /* Redis 中位图的key，多个进程使用同一个key即共享同一个过滤器 */
        private String key = "mcache:bloom:default";
        private long expectedInsertions = 1_000_000L;
        private double falsePositiveRate = 0.01;
    }

    @Data
    public static class Cache {
        private CacheBackend backend = CacheBackend.LOCAL;
        /* 默认过期秒数，0 表示永不过期 */
        private int expireSeconds = 0;
    }

    public enum BloomBackend {
        LOCAL,
        TEMPLATE,
        CONNECTION
    }

    public enum CacheBackend {
        LOCAL,
        REDIS
    }
}
