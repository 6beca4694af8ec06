package com.mcache.cache;

import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;

import lombok.extern.slf4j.Slf4j;

/**
 * 进程内TTL缓存，基于 Caffeine 的按条目过期
 * 每个key有自己的过期时间，读取时顺延（滑动过期）；过期清理由 Caffeine 的调度器触发，并通知监听器
 * 已过期但还没被清理的key读取时按不存在处理
 */
@Slf4j
public class LocalTtlCache extends AbstractTtlCache {

    private final Cache<String, Entry> cache;
    private final BiConsumer<String, Object> expireListener;

    public LocalTtlCache(int expireSeconds) {
        this(expireSeconds, new Random(), Ticker.systemTicker(), ForkJoinPool.commonPool(), null);
    }

    /**
     * @param expireSeconds  默认过期秒数，0 表示永不过期
     * @param random         过期抖动的随机源
     * @param ticker         时间源
     * @param executor       执行清理和监听回调的线程池
     * @param expireListener 过期清理时的回调，可以为 null
     */
    public LocalTtlCache(int expireSeconds, Random random, Ticker ticker, Executor executor,
            BiConsumer<String, Object> expireListener) {
        super(expireSeconds, random);
        this.expireListener = expireListener;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new SlidingExpiry())
                .ticker(ticker)
                .executor(executor)
                .scheduler(Scheduler.systemScheduler())
                .removalListener((String key, Entry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED && entry != null) {
                        notifyExpired(key, entry.value);
                    }
                })
                .build();
    }

    @Override
    public void set(String key, Object value) {
        setWithExpire(key, value, expireSeconds);
    }

    /**
     * 指定的 ttl 同样加抖动，ttl 为 0 时永不过期
     */
    @Override
    public void setWithExpire(String key, Object value, int expireSeconds) {
        if (expireSeconds < 0) {
            throw new IllegalArgumentException("expireSeconds must not be negative: " + expireSeconds);
        }
        cache.put(key, new Entry(value, expireSeconds));
    }

    @Override
    public Object get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public void del(String key) {
        cache.invalidate(key);
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 立即执行一次过期清理
     */
    void sweep() {
        cache.cleanUp();
    }

    private void notifyExpired(String key, Object value) {
        if (expireListener == null) {
            return;
        }
        try {
            expireListener.accept(key, value);
        } catch (RuntimeException e) {
            log.warn("expire listener failed, key: {}", key, e);
        }
    }

    /**
     * 写入和读取都把过期时间重置为 ttl 加抖动
     */
    private final class SlidingExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return duration(entry);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return duration(entry);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return duration(entry);
        }

        private long duration(Entry entry) {
            if (entry.ttlSeconds == 0) {
                return Long.MAX_VALUE;
            }
            return TimeUnit.SECONDS.toNanos(jitter(entry.ttlSeconds));
        }
    }

    private static final class Entry {
        private final Object value;
        private final int ttlSeconds;

        private Entry(Object value, int ttlSeconds) {
            this.value = value;
            this.ttlSeconds = ttlSeconds;
        }
    }
}
