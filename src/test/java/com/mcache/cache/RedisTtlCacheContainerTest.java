package com.mcache.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
class RedisTtlCacheContainerTest {

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory factory;
    private static StringRedisTemplate redis;

    @BeforeAll
    static void connect() {
        factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        factory.afterPropertiesSet();
        redis = new StringRedisTemplate(factory);
        redis.afterPropertiesSet();
    }

    @AfterAll
    static void disconnect() {
        factory.destroy();
    }

    @Test
    void valueAndExpiryAreStoredTogether() {
        RedisTtlCache cache = new RedisTtlCache(redis, 100);

        cache.set("cache:name", "Bess");

        assertThat(cache.getString("cache:name")).isEqualTo("Bess");
        assertThat(redis.getExpire("cache:name", TimeUnit.SECONDS)).isBetween(1L, 110L);
    }

    @Test
    void readRenewsExpiry() {
        RedisTtlCache cache = new RedisTtlCache(redis, 0);
        cache.setWithExpire("cache:renew", 42, 100);
        redis.expire("cache:renew", 5, TimeUnit.SECONDS);

        assertThat(cache.getLong("cache:renew")).isEqualTo(42L);
        assertThat(redis.getExpire("cache:renew", TimeUnit.SECONDS)).isGreaterThan(5L);
    }

    @Test
    void zeroTtlPersists() {
        RedisTtlCache cache = new RedisTtlCache(redis, 0);

        cache.set("cache:forever", true);

        assertThat(cache.getBoolean("cache:forever")).isTrue();
        assertThat(redis.getExpire("cache:forever", TimeUnit.SECONDS)).isEqualTo(-1L);
    }

    @Test
    void missingAndDeletedKeysReadNull() {
        RedisTtlCache cache = new RedisTtlCache(redis, 10);
        cache.set("cache:gone", 1.5D);
        assertThat(cache.getDouble("cache:gone")).isEqualTo(1.5D);

        cache.del("cache:gone");

        assertThat(cache.get("cache:gone")).isNull();
        assertThat(cache.get("cache:never")).isNull();
    }
}
