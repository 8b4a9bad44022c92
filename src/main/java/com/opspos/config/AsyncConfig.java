package com.opspos.config;

import com.opspos.event.ConnectivityEvent;
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
 * Runs the reactions to a connectivity transition off the heartbeat thread that detected it:
 * the replay drain in SyncWorker and the conflict check in CheckLockManager.
 *
 * <p>Two threads let both reactions to one transition run side by side. A flapping link can
 * queue more transitions than that; the oldest waiting reaction is dropped, since the next one
 * does the same work against fresher state and the periodic drain still runs.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${ops-pos.connectivity-reactions.threads:2}")
    private int reactionThreads;

    @Value("${ops-pos.connectivity-reactions.backlog:8}")
    private int reactionBacklog;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(reactionThreads);
        executor.setMaxPoolSize(reactionThreads);
        executor.setQueueCapacity(reactionBacklog);
        executor.setThreadNamePrefix("connectivity-reaction-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> {
            String transition = params.length > 0 && params[0] instanceof ConnectivityEvent
                    ? ((ConnectivityEvent) params[0]).getPreviousMode() + " -> "
                            + ((ConnectivityEvent) params[0]).getCurrentMode()
                    : "unknown transition";
            log.error("{}.{} failed reacting to {}",
                    method.getDeclaringClass().getSimpleName(), method.getName(), transition, throwable);
        };
    }
}
