package com.civiclens.ingestion.config;

import com.civiclens.common.ParallelExecutionOptions;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Enrichment fan-out per record (detail + child collections) and per hearing page.
 */
@ConfigurationProperties(prefix = "civiclens.sync.parallel")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ParallelProperties {

    @Min(1)
    private int concurrency = ParallelExecutionOptions.DEFAULT_CONCURRENCY;

    /** Minimum spacing between successive request starts. */
    @Min(0)
    private long delayBetweenMs = ParallelExecutionOptions.DEFAULT_DELAY_BETWEEN_MS;

    private boolean retry = true;

    @Min(0)
    private int maxRetries = ParallelExecutionOptions.DEFAULT_MAX_RETRIES;

    public ParallelExecutionOptions toOptions() {
        return ParallelExecutionOptions.defaults()
                .withConcurrency(Math.max(1, concurrency))
                .withDelayBetweenMs(Math.max(0L, delayBetweenMs))
                .withRetry(retry, Math.max(0, maxRetries));
    }
}
