package com.mcache.bloom.redis;

import org.springframework.data.redis.core.StringRedisTemplate;

import com.mcache.bloom.FilterParameters;
import com.mcache.bloom.HashQuad;
import com.mcache.config.script.BloomScripts;
import com.mcache.exception.NoBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * 基于 StringRedisTemplate 的 Redis 位存储
 * 脚本返回值由 DefaultRedisScript 直接转换为 Long
 */
@Slf4j
public class TemplateRedisBitMap extends AbstractRedisBitMap {

    private final StringRedisTemplate redis;

    public TemplateRedisBitMap(FilterParameters params, String key, StringRedisTemplate redis) {
        this(params, key, redis, BloomScripts.shared());
    }

    public TemplateRedisBitMap(FilterParameters params, String key, StringRedisTemplate redis, BloomScripts scripts) {
        super(params, key, scripts);
        this.redis = redis;
    }

    @Override
    public void setAll(HashQuad h) {
        template().execute(scripts.setAll(), keys(), (Object[]) args(h));
    }

    @Override
    public boolean testAll(HashQuad h) {
        return toPresent(template().execute(scripts.testAll(), keys(), (Object[]) args(h)));
    }

    @Override
    public boolean testAddAll(HashQuad h) {
        return toPresent(template().execute(scripts.testAddAll(), keys(), (Object[]) args(h)));
    }

    @Override
    public void clearAll() {
        Boolean deleted = template().delete(key);
        log.debug("clear bloom key: {}, deleted: {}", key, deleted);
    }

    private StringRedisTemplate template() {
        if (redis == null) {
            throw new NoBackendException("no redis client for bloom key: " + key);
        }
        return redis;
    }
}
