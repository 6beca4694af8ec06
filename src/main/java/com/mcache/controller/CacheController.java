package com.mcache.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.mcache.cache.TtlCache;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/cache")
@RequiredArgsConstructor
public class CacheController {

    private final TtlCache ttlCache;

    /**
     * 不传 ttl 时使用默认过期时间
     */
    @PutMapping("/{key}")
    public Map<String, Object> set(@PathVariable("key") String key, @RequestBody String value,
            @RequestParam(value = "ttl", required = false) Integer ttl) {
        if (ttl == null) {
            ttlCache.set(key, value);
        } else {
            ttlCache.setWithExpire(key, value, ttl);
        }
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        return response;
    }

    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable("key") String key) {
        String value = ttlCache.getString(key);
        Map<String, Object> response = new HashMap<>();
        response.put("key", key);
        if (value == null) {
            response.put("success", false);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("success", true);
        response.put("value", value);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{key}")
    public Map<String, Object> del(@PathVariable("key") String key) {
        ttlCache.del(key);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        return response;
    }
}
