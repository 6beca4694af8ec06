package com.mcache.config.script;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.springframework.data.redis.core.script.DefaultRedisScript;

/**
 * TTL缓存脚本，值存放在 hash 的 data 字段，过期秒数存放在 exp 字段
 */
public class CacheScripts extends LuaScriptConfig {

    public static final String GET_CACHE = "get_cache";
    public static final String SET_CACHE = "set_cache";

    private static final CacheScripts SHARED = new CacheScripts();

    public static CacheScripts shared() {
        return SHARED;
    }

    @Override
    protected Map<String, Class<?>> buildReturnTypeMap() {
        Map<String, Class<?>> returnTypeMap = new HashMap<>();
        returnTypeMap.put(GET_CACHE, String.class);
        returnTypeMap.put(SET_CACHE, Long.class);
        return Collections.unmodifiableMap(returnTypeMap);
    }

    @Override
    protected String getScriptDirectory() {
        return "classpath:lua/cache/*.lua";
    }

    public DefaultRedisScript<String> getCache() {
        return getScript(GET_CACHE, String.class);
    }

    public DefaultRedisScript<Long> setCache() {
        return getScript(SET_CACHE, Long.class);
    }
}
