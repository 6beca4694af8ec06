package com.mcache.config.script;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import lombok.extern.slf4j.Slf4j;

/**
 * Lua脚本加载基类
 * 按功能建目录，每个目录一个子类，子类只需要指定目录和各脚本的返回值类型
 * 脚本只加载一次，不依赖 Spring 容器，普通对象也可以直接使用
 */
@Slf4j
public abstract class LuaScriptConfig {

    private volatile boolean initialized = false;
    private final Object initializationMonitor = new Object();
    private Map<String, DefaultRedisScript<?>> cachedScripts = Collections.emptyMap();

    /**
     * 获取脚本，返回值类型必须与 {@link #buildReturnTypeMap()} 中登记的一致
     */
    @SuppressWarnings("unchecked")
    public <T> DefaultRedisScript<T> getScript(String scriptName, Class<T> resultType) {
        ensureInitialized();
        DefaultRedisScript<?> script = cachedScripts.get(scriptName);
        if (script == null) {
            throw new IllegalArgumentException(
                    "lua script not found: " + scriptName + ", existing scripts: " + cachedScripts.keySet());
        }
        if (!resultType.equals(script.getResultType())) {
            throw new IllegalArgumentException(String.format(
                    "script: %s return type mismatch, expected: %s, registered: %s",
                    scriptName, resultType.getName(), script.getResultType()));
        }
        return (DefaultRedisScript<T>) script;
    }

    /**
     * 确保脚本已初始化（双重检查锁定）
     */
    private void ensureInitialized() {
        if (initialized) {
            return;
        }
        synchronized (initializationMonitor) {
            if (initialized) {
                return;
            }
            this.cachedScripts = loadScripts(buildReturnTypeMap());
            this.initialized = true;
        }
    }

    /**
     * 脚本名称到返回类型的映射，未登记的脚本默认按 Long 处理
     */
    protected abstract Map<String, Class<?>> buildReturnTypeMap();

    /**
     * 脚本目录（相对于classpath），例如 "classpath:lua/bloom/*.lua"
     * classpath对应maven目录的src/main/resources
     */
    protected abstract String getScriptDirectory();

    /**
     * 脚本分类名称（用于日志）
     */
    protected String getScriptCategoryName() {
        String directory = getScriptDirectory();
        int begin = directory.indexOf('/'), end = directory.lastIndexOf('/');
        if (begin != -1 && end != -1) {
            return directory.substring(begin + 1, end);
        }
        return "scripts";
    }

    @SuppressWarnings({ "rawtypes", "unchecked" })
    private Map<String, DefaultRedisScript<?>> loadScripts(Map<String, Class<?>> returnTypeMap) {
        Map<String, DefaultRedisScript<?>> luaScriptMap = new HashMap<>();
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver(getClass().getClassLoader());
        try {
            Resource[] resources = resolver.getResources(getScriptDirectory());
            log.info("Loading {} scripts, resources size: {}", getScriptCategoryName(), resources.length);

            for (Resource res : resources) {
                String name = res.getFilename();
                if (name == null || !name.contains(".")) {
                    log.warn("file name is null or not contains '.': {}", name);
                    continue;
                }
                String key = name.substring(0, name.lastIndexOf('.'));

                DefaultRedisScript script = new DefaultRedisScript<>();
                script.setLocation(res);
                Class<?> returnType = returnTypeMap.get(key);
                if (returnType == null) {
                    log.warn("not found return type for script: {}, default set Long", key);
                    returnType = Long.class;
                }
                script.setResultType(returnType);
                luaScriptMap.put(key, script);
            }
        } catch (IOException e) {
            throw new IllegalStateException("load " + getScriptCategoryName() + " lua scripts failed", e);
        }
        for (String expected : returnTypeMap.keySet()) {
            if (!luaScriptMap.containsKey(expected)) {
                throw new IllegalStateException("missing " + getScriptCategoryName() + " lua script: " + expected);
            }
        }
        Map<String, DefaultRedisScript<?>> unmodifiable = Collections.unmodifiableMap(luaScriptMap);
        log.info("Loaded {} scripts: {}", getScriptCategoryName(), unmodifiable.keySet());
        return unmodifiable;
    }
}
