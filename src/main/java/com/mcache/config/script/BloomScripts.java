package com.mcache.config.script;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.springframework.data.redis.core.script.DefaultRedisScript;

/**
 * 布隆过滤器脚本，两种 Redis 绑定共用同一份脚本
 * 参数约定：KEYS[1] 过滤器key，ARGV = k, m, 4个16位十六进制哈希值
 */
public class BloomScripts extends LuaScriptConfig {

    public static final String SET_ALL = "set_all";
    public static final String TEST_ALL = "test_all";
    public static final String TEST_ADD_ALL = "test_add_all";

    private static final BloomScripts SHARED = new BloomScripts();

    public static BloomScripts shared() {
        return SHARED;
    }

    @Override
    protected Map<String, Class<?>> buildReturnTypeMap() {
        Map<String, Class<?>> returnTypeMap = new HashMap<>();
        returnTypeMap.put(SET_ALL, Long.class);
        returnTypeMap.put(TEST_ALL, Long.class);
        returnTypeMap.put(TEST_ADD_ALL, Long.class);
        return Collections.unmodifiableMap(returnTypeMap);
    }

    @Override
    protected String getScriptDirectory() {
        return "classpath:lua/bloom/*.lua";
    }

    public DefaultRedisScript<Long> setAll() {
        return getScript(SET_ALL, Long.class);
    }

    public DefaultRedisScript<Long> testAll() {
        return getScript(TEST_ALL, Long.class);
    }

    public DefaultRedisScript<Long> testAddAll() {
        return getScript(TEST_ADD_ALL, Long.class);
    }
}
