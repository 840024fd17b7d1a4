package com.civiclens.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for the hourly ScheduledSyncJob. On shutdown a trigger already in flight gets
 * {@link #SHUTDOWN_GRACE_SECONDS} to finalize its sync run before the pool is torn down.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    static final int SHUTDOWN_GRACE_SECONDS = 30;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setErrorHandler(t -> log.error("Scheduled sync trigger failed: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_GRACE_SECONDS);
        scheduler.initialize();
        return scheduler;
    }
}
