package com.mcache.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.mcache.cache.LocalTtlCache;
import com.mcache.cache.RedisTtlCache;
import com.mcache.cache.TtlCache;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties(MCacheProperties.class)
public class CacheConfig {

    /**
     * 默认使用进程内缓存，配置为 redis 时没有 Redis 客户端也能创建，读写时才报错
     */
    @Bean
    public TtlCache ttlCache(MCacheProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
        MCacheProperties.Cache cache = properties.getCache();
        log.info("ttl cache created, backend: {}, expireSeconds: {}", cache.getBackend(), cache.getExpireSeconds());
        if (cache.getBackend() == MCacheProperties.CacheBackend.REDIS) {
            return new RedisTtlCache(redisTemplate.getIfAvailable(), cache.getExpireSeconds());
        }
        return new LocalTtlCache(cache.getExpireSeconds());
    }
}
