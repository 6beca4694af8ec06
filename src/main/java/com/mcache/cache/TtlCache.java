package com.mcache.cache;

/**
 * 带过期时间的 key/value 缓存统一接口
 * 读不到时返回 null；类型转换失败时抛出 DataTypeException
 */
public interface TtlCache {

    /**
     * 使用默认过期时间（带随机抖动）写入
     */
    void set(String key, Object value);

    /**
     * 指定过期秒数写入，0 表示永不过期
     */
    void setWithExpire(String key, Object value, int expireSeconds);

    Object get(String key);

    Long getLong(String key);

    Double getDouble(String key);

    String getString(String key);

    byte[] getBytes(String key);

    Boolean getBoolean(String key);

    void del(String key);
}
