package com.mcache.exception;

/**
 * 缓存与布隆过滤器操作异常的基类
 * 用于封装存储相关的错误，便于统一处理和区分业务异常
 */
public class CacheOperationException extends RuntimeException {

    public CacheOperationException(String message) {
        super(message);
    }

    public CacheOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
