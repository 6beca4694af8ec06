package com.mcache.bloom;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mcache.bloom.redis.ConnectionRedisBitMap;
import com.mcache.bloom.redis.TemplateRedisBitMap;
import com.mcache.exception.CacheOperationException;

import lombok.extern.slf4j.Slf4j;

/**
 * 布隆过滤器
 * 判断元素是否可能存在于集合中：返回false表示一定不存在，返回true可能是误判
 * 位存储可以是进程内的 {@link LocalBitMap}，也可以是多个进程共享的 Redis 位图
 *
 * 用法：
 * <pre>
 *     BloomFilter filter = BloomFilter.localWithEstimates(1000, 0.01);
 *     filter.addString("Love");
 *     filter.testString("Love"); // true
 * </pre>
 */
@Slf4j
public class BloomFilter {

    /**
     * 误判率估算时测试的轮数
     */
    public static final int ESTIMATE_ROUNDS = 100_000;

    /**
     * 误判率估算时同时执行的最大任务数
     */
    public static final int MAX_IN_FLIGHT = 1000;

    private final BitMap bitMap;

    public BloomFilter(BitMap bitMap) {
        this.bitMap = bitMap;
    }

    // ==================== 构造 ====================

    public static BloomFilter local(long m, int k) {
        return new BloomFilter(new LocalBitMap(FilterParameters.of(m, k)));
    }

    public static BloomFilter localWithEstimates(long n, double fp) {
        return new BloomFilter(new LocalBitMap(FilterParameters.estimate(n, fp)));
    }

    /**
     * redis 为 null 时构造成功，但之后每次操作都会抛出 NoBackendException
     */
    public static BloomFilter redisTemplate(long m, int k, String key, StringRedisTemplate redis) {
        return new BloomFilter(new TemplateRedisBitMap(FilterParameters.of(m, k), key, redis));
    }

    public static BloomFilter redisTemplateWithEstimates(long n, double fp, String key, StringRedisTemplate redis) {
        return new BloomFilter(new TemplateRedisBitMap(FilterParameters.estimate(n, fp), key, redis));
    }

    public static BloomFilter redisConnection(long m, int k, String key, Supplier<RedisConnection> connections) {
        return new BloomFilter(new ConnectionRedisBitMap(FilterParameters.of(m, k), key, connections));
    }

    public static BloomFilter redisConnectionWithEstimates(long n, double fp, String key,
            Supplier<RedisConnection> connections) {
        return new BloomFilter(new ConnectionRedisBitMap(FilterParameters.estimate(n, fp), key, connections));
    }

    // ==================== 基本操作 ====================

    /**
     * 位数组大小 m
     */
    public long cap() {
        return bitMap.m();
    }

    /**
     * 哈希函数个数 k
     */
    public int k() {
        return bitMap.k();
    }

    public void add(byte[] data) {
        bitMap.setAll(HashQuad.of(data));
    }

    public void addString(String data) {
        add(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * true 可能是误判，false 表示一定不存在
     */
    public boolean test(byte[] data) {
        return bitMap.testAll(HashQuad.of(data));
    }

    public boolean testString(String data) {
        return test(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 等价于先 test 再 add，但整体是原子的，返回 add 之前 test 的结果
     */
    public boolean testAndAdd(byte[] data) {
        return bitMap.testAddAll(HashQuad.of(data));
    }

    public boolean testAndAddString(String data) {
        return testAndAdd(data.getBytes(StandardCharsets.UTF_8));
    }

    public void clearAll() {
        bitMap.clearAll();
    }

    // ==================== 误判率估算 ====================

    /**
     * 经验估算存入 n 个元素后的误判率：用整数作为key，插入 n 个后再测试 100000 个不相交的key
     * 注意：调用前后都会清空过滤器
     */
    public double estimateFalsePositiveRate(int n) {
        return estimateFalsePositiveRate(n, EstimateExecutorHolder.EXECUTOR);
    }

    public double estimateFalsePositiveRate(int n, Executor executor) {
        clearAll();
        runBounded(n, executor, i -> add(Ints.toByteArray(i)));

        AtomicInteger fp = new AtomicInteger();
        runBounded(ESTIMATE_ROUNDS, executor, i -> {
            if (test(Ints.toByteArray(i + n + 1))) {
                fp.incrementAndGet();
            }
        });
        double fpRate = (double) fp.get() / ESTIMATE_ROUNDS;
        clearAll();
        log.info("estimated false positive rate, n: {}, m: {}, k: {}, false positives: {}, rate: {}",
                n, cap(), k(), fp.get(), fpRate);
        return fpRate;
    }

    /**
     * 以最多 MAX_IN_FLIGHT 个并发执行 count 个任务，全部完成后才返回
     * 任务抛出的第一个异常在本阶段结束后重新抛出
     */
    private static void runBounded(int count, Executor executor, IntConsumer task) {
        Semaphore permits = new Semaphore(MAX_IN_FLIGHT);
        CountDownLatch done = new CountDownLatch(count);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        try {
            for (int i = 0; i < count; i++) {
                permits.acquire();
                final int ii = i;
                try {
                    executor.execute(() -> {
                        try {
                            task.accept(ii);
                        } catch (RuntimeException e) {
                            failure.compareAndSet(null, e);
                        } finally {
                            permits.release();
                            done.countDown();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    failure.compareAndSet(null, e);
                    permits.release();
                    done.countDown();
                }
            }
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheOperationException("interrupted while estimating false positive rate", e);
        }
        RuntimeException e = failure.get();
        if (e != null) {
            throw e;
        }
    }

    /**
     * 不传线程池时使用的共享线程池，第一次估算时才创建，守护线程不阻止 JVM 退出
     */
    private static final class EstimateExecutorHolder {
        private static final ExecutorService EXECUTOR = Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors() * 2,
                new ThreadFactoryBuilder().setNameFormat("bloom-estimate-%d").setDaemon(true).build());
    }
}
