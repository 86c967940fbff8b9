package com.example.ingestionservice.config;

import com.example.ingestionservice.metrics.IngestionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration for backfill task execution.
 * 
 * CRITICAL: One task = one batch. Records inside a batch are processed
 * sequentially on the task thread, so the pool size bounds how many batches
 * contend on the shared lookup throttle.
 * 
 * Production Safety:
 * - Core pool: 2 threads (always alive)
 * - Max pool: 4 threads
 * - Queue: 50 tasks (bounded queue prevents memory exhaustion)
 * - Rejection: AbortPolicy (submission endpoint reports the rejection)
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Bean(name = "backfillTaskExecutor")
    public ThreadPoolTaskExecutor backfillTaskExecutor(
            IngestionMetrics ingestionMetrics,
            @Value("${ingestion.async.core-pool-size:2}") int corePoolSize,
            @Value("${ingestion.async.max-pool-size:4}") int maxPoolSize,
            @Value("${ingestion.async.queue-capacity:50}") int queueCapacity,
            @Value("${ingestion.async.thread-name-prefix:backfill-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // AbortPolicy = Throw RejectedExecutionException if queue full (must handle explicitly)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Batches are resumable, so shutdown does not wait for hours-long backfills
        executor.setWaitForTasksToCompleteOnShutdown(false);

        // MDC propagation: Correlation IDs propagate to async threads
        executor.setTaskDecorator(new MdcTaskDecorator());

        executor.initialize();
        ingestionMetrics.registerThreadPoolMetrics("backfillTaskExecutor", executor.getThreadPoolExecutor());

        log.info("✅ Initialized backfillTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);

        return executor;
    }
}
