package com.civiclens.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: sync-executor runs whole orchestrator invocations; sync-fetch-executor runs the
 * parallel upstream calls issued by ParallelExecutor.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "sync-executor";
    public static final String SYNC_FETCH_EXECUTOR = "sync-fetch-executor";

    /** One orchestrator at a time; a second manual trigger queues behind it. */
    @Bean(name = SYNC_EXECUTOR)
    public Executor syncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("sync-");
        e.initialize();
        return e;
    }

    /** Sized above the per-call concurrency so that hearing chunks and bill enrichment never starve. */
    @Bean(name = SYNC_FETCH_EXECUTOR)
    public Executor syncFetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(8);
        e.setThreadNamePrefix("sync-fetch-");
        e.initialize();
        return e;
    }
}
