package com.whalewatch.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for connection slots. Slot startup and reconnects run on {@code slotExecutor}, which
 * hands every task its own thread (no queue) and only falls back to the caller once the maximum is
 * reached. Socket cleanup runs on {@code cleanupExecutor}, which never uses the caller.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${monitor.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${monitor.async.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${monitor.async.cleanup-pool-size:16}")
    private int cleanupPoolSize;

    @Bean("slotExecutor")
    public ThreadPoolTaskExecutor slotExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("slot-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * Runs bounded unsubscribe/close calls. A hung close keeps its worker, so this pool rejects
     * once full instead of running the call on the caller.
     */
    @Bean("cleanupExecutor")
    public ThreadPoolTaskExecutor cleanupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(cleanupPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("slot-cleanup-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return slotExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
