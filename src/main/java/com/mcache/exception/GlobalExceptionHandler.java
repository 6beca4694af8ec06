package com.mcache.exception;

import java.util.HashMap;
import java.util.Map;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;

import lombok.extern.slf4j.Slf4j;

/**
 * 全局异常处理器
 * 统一处理Controller层的异常，避免重复的try-catch代码
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 没有配置 Redis
     */
    @ExceptionHandler(NoBackendException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleNoBackendException(NoBackendException e) {
        log.warn("No backend: {}", e.getMessage());
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    /**
     * Redis 返回值类型不符
     */
    @ExceptionHandler(DataTypeException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleDataTypeException(DataTypeException e) {
        log.warn("Data type mismatch: {}", e.getMessage(), e);
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(CacheOperationException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleCacheOperationException(CacheOperationException e) {
        log.warn("Cache operation failed: {}", e.getMessage(), e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    /**
     * 连接失败，不做重试，直接返回
     */
    @ExceptionHandler(DataAccessResourceFailureException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleResourceFailure(DataAccessResourceFailureException e) {
        log.error("Redis unavailable", e);
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "redis unavailable: " + e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleDataAccessException(DataAccessException e) {
        log.error("Redis operation failed", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "redis error: " + e.getMessage());
    }

    /**
     * 处理非法参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage(), e);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 处理所有未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unexpected error occurred", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "服务器内部错误，请稍后重试");
    }

    /**
     * 构建错误响应
     */
    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", message);
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.status(status).body(response);
    }
}
