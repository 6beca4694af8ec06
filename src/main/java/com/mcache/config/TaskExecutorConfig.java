package com.mcache.config;

import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 线程池配置
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * 误判率估算专用的线程池
     * 同时在途的任务数由 BloomFilter 自己的信号量限制，队列满时由调用线程执行，不丢任务
     */
    @Bean("bloomEstimateExecutor")
    public ThreadPoolTaskExecutor bloomEstimateExecutor() {
        int cores = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cores);
        executor.setMaxPoolSize(cores * 4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("bloom-estimate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        // 优雅关闭配置
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
