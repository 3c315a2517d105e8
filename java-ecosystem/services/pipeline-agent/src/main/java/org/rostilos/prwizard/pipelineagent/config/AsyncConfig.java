package org.rostilos.prwizard.pipelineagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Thread pools for webhook processing and the expiry sweep.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Dedicated executor for webhook processing.
     * Each delivery is handled as an independent task; no ordering between deliveries.
     */
    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.error("WEBHOOK EXECUTOR REJECTED TASK! Queue is full. Pool size: {}, Active: {}, Queue size: {}",
                    e.getPoolSize(), e.getActiveCount(), e.getQueue().size());
            // Run in caller thread as fallback
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();
        log.info("Webhook executor initialized with core={}, max={}, queueCapacity={}", 4, 8, 100);
        return executor;
    }

    /**
     * Single-threaded scheduler owned by the expiry sweeper, so ticks never overlap.
     */
    @Bean(name = "sweeperScheduler")
    public TaskScheduler sweeperScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("annotation-sweeper-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
