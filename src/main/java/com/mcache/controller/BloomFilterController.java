package com.mcache.controller;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.mcache.bloom.BloomFilter;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/bloom")
public class BloomFilterController {

    private final BloomFilter bloomFilter;

    private final Executor estimateExecutor;

    public BloomFilterController(BloomFilter bloomFilter,
            @Qualifier("bloomEstimateExecutor") Executor estimateExecutor) {
        this.bloomFilter = bloomFilter;
        this.estimateExecutor = estimateExecutor;
    }

    @PostMapping("/add")
    public Map<String, Object> add(@RequestParam("key") String key) {
        bloomFilter.addString(key);
        return result("added", true);
    }

    @GetMapping("/test")
    public Map<String, Object> test(@RequestParam("key") String key) {
        return result("present", bloomFilter.testString(key));
    }

    /**
     * 返回添加之前是否已存在
     */
    @PostMapping("/test-and-add")
    public Map<String, Object> testAndAdd(@RequestParam("key") String key) {
        return result("present", bloomFilter.testAndAddString(key));
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        bloomFilter.clearAll();
        log.info("bloom filter cleared by request");
        return result("cleared", true);
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new HashMap<>();
        info.put("cap", bloomFilter.cap());
        info.put("k", bloomFilter.k());
        return info;
    }

    /**
     * 会清空过滤器中已有的数据
     */
    @PostMapping("/estimate")
    public Map<String, Object> estimate(@RequestParam("n") int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        return result("falsePositiveRate", bloomFilter.estimateFalsePositiveRate(n, estimateExecutor));
    }

    private static Map<String, Object> result(String name, Object value) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put(name, value);
        return response;
    }
}
