package com.mcache.config;

import java.util.function.Supplier;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.mcache.bloom.BloomFilter;

import lombok.extern.slf4j.Slf4j;

/**
 * 按配置创建布隆过滤器，参数由预期元素数量和误判率估算
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MCacheProperties.class)
public class BloomFilterConfig {

    @Bean
    public BloomFilter bloomFilter(MCacheProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            ObjectProvider<RedisConnectionFactory> connectionFactory) {
        MCacheProperties.Bloom bloom = properties.getBloom();
        long n = bloom.getExpectedInsertions();
        double fp = bloom.getFalsePositiveRate();
        BloomFilter filter;
        switch (bloom.getBackend()) {
            case TEMPLATE:
                filter = BloomFilter.redisTemplateWithEstimates(n, fp, bloom.getKey(), redisTemplate.getIfAvailable());
                break;
            case CONNECTION:
                RedisConnectionFactory factory = connectionFactory.getIfAvailable();
                Supplier<RedisConnection> connections = factory == null ? null : factory::getConnection;
                filter = BloomFilter.redisConnectionWithEstimates(n, fp, bloom.getKey(), connections);
                break;
            default:
                filter = BloomFilter.localWithEstimates(n, fp);
        }
        log.info("bloom filter created, backend: {}, key: {}, n: {}, fp: {}, m: {}, k: {}",
                bloom.getBackend(), bloom.getKey(), n, fp, filter.cap(), filter.k());
        return filter;
    }
}
