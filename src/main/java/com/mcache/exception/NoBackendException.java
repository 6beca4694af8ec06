package com.mcache.exception;

/**
 * 没有配置 Redis 客户端或连接
 * 立即抛出，不会被当作"不存在"处理
 */
public class NoBackendException extends CacheOperationException {

    public NoBackendException(String message) {
        super(message);
    }
}
