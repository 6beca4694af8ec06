package com.mcache.exception;

/**
 * 返回值或存储的值无法转换为期望的类型
 * 对 Redis 脚本来说通常意味着协议或版本不匹配
 */
public class DataTypeException extends CacheOperationException {

    public DataTypeException(String message) {
        super(message);
    }

    public DataTypeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DataTypeException of(String expected, Object actual) {
        String actualType = actual == null ? "null" : actual.getClass().getName();
        return new DataTypeException("result data type error, expected: " + expected + ", actual: " + actualType);
    }
}
