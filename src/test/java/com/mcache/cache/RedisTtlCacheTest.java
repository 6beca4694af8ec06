package com.mcache.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.mcache.config.script.CacheScripts;
import com.mcache.exception.DataTypeException;
import com.mcache.exception.NoBackendException;

class RedisTtlCacheTest {

    private final CacheScripts scripts = CacheScripts.shared();
    private final List<String> keys = Collections.singletonList("name");

    private StringRedisTemplate redis;
    private RedisTtlCache cache;

    @BeforeEach
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        Random fixed = new Random() {
            @Override
            public int nextInt(int bound) {
                return bound - 1;
            }
        };
        cache = new RedisTtlCache(redis, 100, fixed, scripts);
    }

    @Test
    void setAddsJitterToDefaultTtl() {
        cache.set("name", "Bess");

        verify(redis).execute(scripts.setCache(), keys, "Bess", "110");
    }

    @Test
    void setWithExpireUsesGivenTtl() {
        cache.setWithExpire("name", 42, 30);
        cache.setWithExpire("bytes", "Jane".getBytes(StandardCharsets.UTF_8), 0);

        verify(redis).execute(scripts.setCache(), keys, "42", "30");
        verify(redis).execute(scripts.setCache(), Collections.singletonList("bytes"), "Jane", "0");
    }

    @Test
    void nullValuesAndNegativeTtlAreRejected() {
        assertThatThrownBy(() -> cache.set("name", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.setWithExpire("name", "Bess", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void typedGettersParseStoredStrings() {
        when(redis.execute(scripts.getCache(), keys)).thenReturn("12");

        assertThat(cache.get("name")).isEqualTo("12");
        assertThat(cache.getLong("name")).isEqualTo(12L);
        assertThat(cache.getDouble("name")).isEqualTo(12D);
        assertThat(cache.getString("name")).isEqualTo("12");
        assertThat(cache.getBytes("name")).isEqualTo("12".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> cache.getBoolean("name")).isInstanceOf(DataTypeException.class);
    }

    @Test
    void booleanStrings() {
        when(redis.execute(scripts.getCache(), keys)).thenReturn("true");

        assertThat(cache.getBoolean("name")).isTrue();
        assertThatThrownBy(() -> cache.getLong("name")).isInstanceOf(DataTypeException.class);
    }

    @Test
    void missingKeyReadsNull() {
        when(redis.execute(scripts.getCache(), keys)).thenReturn(null);

        assertThat(cache.get("name")).isNull();
        assertThat(cache.getLong("name")).isNull();
    }

    @Test
    void delRemovesKey() {
        cache.del("name");

        verify(redis).delete("name");
    }

    @Test
    void missingClientIsNoBackend() {
        RedisTtlCache none = new RedisTtlCache(null, 10);

        assertThatThrownBy(() -> none.set("name", "Bess")).isInstanceOf(NoBackendException.class);
        assertThatThrownBy(() -> none.get("name")).isInstanceOf(NoBackendException.class);
        assertThatThrownBy(() -> none.del("name")).isInstanceOf(NoBackendException.class);
    }
}
