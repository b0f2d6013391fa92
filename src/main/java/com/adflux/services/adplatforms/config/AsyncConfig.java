package com.adflux.services.adplatforms.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Thread pool configuration.
 *
 * adFanOutExecutor: used by AdPlatformService multi-platform calls
 * ──────────────────────────────────────────────────────────────────
 * One task per platform in a fan-out. Each task blocks on platform I/O,
 * including retry backoff (up to 5s * 2^n on rate limits).
 * Sized from adplatforms.fan-out.*.
 *
 * eventTaskExecutor: used by PlatformEventLogListener
 * ─────────────────────────────────────────────────────
 * Event delivery is fire-and-forget and must never slow down a platform call.
 *
 * authRefreshScheduler: used by AuthManager
 * ───────────────────────────────────────────
 * Hosts one pending refresh timer per authenticated platform.
 */
@Configuration
@EnableAsync
@EnableScheduling
@RequiredArgsConstructor
public class AsyncConfig {

    private final AdPlatformsProperties properties;

    @Bean(name = "adFanOutExecutor")
    public Executor adFanOutExecutor() {
        AdPlatformsProperties.FanOut fanOut = properties.getFanOut();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fanOut.getCorePoolSize());
        executor.setMaxPoolSize(fanOut.getMaxPoolSize());
        executor.setQueueCapacity(fanOut.getQueueCapacity());
        executor.setThreadNamePrefix("ad-fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "eventTaskExecutor")
    public Executor eventTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("ad-events-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "authRefreshScheduler")
    public TaskScheduler authRefreshScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("auth-refresh-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
