package com.mcache.cache;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Random;

import org.springframework.data.redis.core.StringRedisTemplate;

import com.mcache.config.script.CacheScripts;
import com.mcache.exception.NoBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * 基于 Redis 的TTL缓存
 * 值以字符串形式存放在 hash 的 data 字段，exp 字段记录过期秒数，每次读取都会重新设置过期时间
 * 读写都通过Lua脚本完成，保证值和过期时间一起生效
 */
@Slf4j
public class RedisTtlCache extends AbstractTtlCache {

    private final StringRedisTemplate redis;
    private final CacheScripts scripts;

    public RedisTtlCache(StringRedisTemplate redis, int expireSeconds) {
        this(redis, expireSeconds, new Random(), CacheScripts.shared());
    }

    public RedisTtlCache(StringRedisTemplate redis, int expireSeconds, Random random, CacheScripts scripts) {
        super(expireSeconds, random);
        this.redis = redis;
        this.scripts = scripts;
    }

    @Override
    public void set(String key, Object value) {
        write(key, value, jitter(expireSeconds));
    }

    /**
     * 指定的 ttl 不加抖动
     */
    @Override
    public void setWithExpire(String key, Object value, int expireSeconds) {
        if (expireSeconds < 0) {
            throw new IllegalArgumentException("expireSeconds must not be negative: " + expireSeconds);
        }
        write(key, value, expireSeconds);
    }

    /**
     * key 不存在时返回 null，而不是异常
     */
    @Override
    public String get(String key) {
        return template().execute(scripts.getCache(), Collections.singletonList(key));
    }

    @Override
    public void del(String key) {
        Boolean deleted = template().delete(key);
        log.debug("del cache key: {}, deleted: {}", key, deleted);
    }

    private void write(String key, Object value, int ttl) {
        template().execute(scripts.setCache(), Collections.singletonList(key), stringify(value), String.valueOf(ttl));
    }

    private static String stringify(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("redis cache does not store null values");
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    private StringRedisTemplate template() {
        if (redis == null) {
            throw new NoBackendException("no redis client for ttl cache");
        }
        return redis;
    }
}
