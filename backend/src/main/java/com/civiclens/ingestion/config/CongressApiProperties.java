package com.civiclens.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Congress.gov v3 API client config.
 */
@ConfigurationProperties(prefix = "civiclens.congress-api")
@NoArgsConstructor
@Getter
@Setter
public class CongressApiProperties {

    private String baseUrl = "https://api.congress.gov/v3";

    /** api.data.gov key, sent as the api_key query parameter. */
    private String apiKey;

    private long timeoutMs = 30_000;

    /** Local smoothing on top of the hourly budget. */
    private int maxRequestsPerSecond = 10;

    /** Max wait for a local limiter permit before the call fails. */
    private long localLimiterTimeoutMs = 5_000;

    private int maxInMemorySizeBytes = 4 * 1024 * 1024;
}
