package com.civiclens.ingestion.config;

import com.civiclens.common.ParallelExecutor;
import com.civiclens.common.RateLimitMonitor;
import com.civiclens.config.AsyncConfig;
import com.civiclens.ingestion.adapter.CongressApiClient;
import com.civiclens.ingestion.adapter.WebClientCongressApiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the Congress.gov client, the hourly request monitor and the parallel executor.
 */
@Configuration
@EnableConfigurationProperties({ SyncProperties.class, ParallelProperties.class, CongressApiProperties.class })
public class SyncEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Process-wide: every upstream call, from any sync routine, counts against the same hourly cap. */
    @Bean
    public RateLimitMonitor rateLimitMonitor(SyncProperties syncProperties, Clock clock) {
        return new RateLimitMonitor(syncProperties.getMaxRequestsPerHour(), clock);
    }

    @Bean
    public ParallelExecutor parallelExecutor(@Qualifier(AsyncConfig.SYNC_FETCH_EXECUTOR) Executor fetchExecutor) {
        return new ParallelExecutor(fetchExecutor);
    }

    @Bean(name = "congressApiRateLimiter")
    public RateLimiter congressApiRateLimiter(CongressApiProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("congress-api", config);
    }

    @Bean
    public CongressApiClient congressApiClient(WebClient.Builder webClientBuilder, CongressApiProperties properties,
                                               RateLimitMonitor rateLimitMonitor,
                                               @Qualifier("congressApiRateLimiter") RateLimiter rateLimiter,
                                               ObjectMapper objectMapper) {
        WebClient webClient = webClientBuilder
                .baseUrl(properties.getBaseUrl())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySizeBytes()))
                .build();
        return new WebClientCongressApiClient(webClient, properties, rateLimitMonitor, rateLimiter, objectMapper);
    }
}
