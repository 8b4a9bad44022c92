package com.opspos.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Shared scheduler for the periodic loops: three heartbeat probes, the replay drain,
 * the fiscal tick and the recovery health loop. Sized so a slow probe never delays
 * another loop.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Value("${spring.task.scheduling.pool.size:6}")
    private int poolSize;

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("ops-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable -> log.error("Scheduled task failed: {}", throwable.getMessage(), throwable));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }
}
