package com.mcache.cache;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import com.mcache.exception.DataTypeException;

/**
 * 类型转换和过期抖动的公共实现
 * 过期时间加上 [0, ttl/10] 秒的随机抖动，避免同一批key同时失效造成缓存雪崩
 */
public abstract class AbstractTtlCache implements TtlCache {

    protected final int expireSeconds;
    private final Random random;

    protected AbstractTtlCache(int expireSeconds, Random random) {
        if (expireSeconds < 0) {
            throw new IllegalArgumentException("expireSeconds must not be negative: " + expireSeconds);
        }
        this.expireSeconds = expireSeconds;
        this.random = random;
    }

    /**
     * ttl 为 0 时不过期，不加抖动
     */
    protected int jitter(int ttl) {
        if (ttl == 0) {
            return 0;
        }
        synchronized (random) {
            return ttl + random.nextInt(ttl / 10 + 1);
        }
    }

    @Override
    public Long getLong(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new DataTypeException("value of key " + key + " is not an integer: " + value, e);
            }
        }
        throw DataTypeException.of("integer", value);
    }

    @Override
    public Double getDouble(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new DataTypeException("value of key " + key + " is not a float: " + value, e);
            }
        }
        throw DataTypeException.of("float", value);
    }

    @Override
    public String getString(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        throw DataTypeException.of("string", value);
    }

    @Override
    public byte[] getBytes(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        throw DataTypeException.of("bytes", value);
    }

    /**
     * 数字 1、字符串 "true"/"1"/"t"/"T" 为 true，"false"/"0"/"f"/"F" 为 false
     */
    @Override
    public Boolean getBoolean(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 1D;
        }
        if (value instanceof String) {
            switch ((String) value) {
                case "true":
                case "TRUE":
                case "True":
                case "1":
                case "t":
                case "T":
                    return true;
                case "false":
                case "FALSE":
                case "False":
                case "0":
                case "f":
                case "F":
                    return false;
                default:
                    throw new DataTypeException("value of key " + key + " is not a boolean: " + value);
            }
        }
        throw DataTypeException.of("boolean", value);
    }
}
