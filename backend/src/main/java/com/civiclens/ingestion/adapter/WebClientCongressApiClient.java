package com.civiclens.ingestion.adapter;

import com.civiclens.common.RateLimitMonitor;
import com.civiclens.ingestion.config.CongressApiProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Congress.gov client using WebClient, blocking at this boundary. Every call takes a local limiter permit,
 * is recorded on the RateLimitMonitor, and feeds the x-ratelimit-* headers back into it.
 */
@Slf4j
public class WebClientCongressApiClient implements CongressApiClient {

    private static final int ERROR_BODY_SNIPPET = 200;

    private final WebClient webClient;
    private final CongressApiProperties properties;
    private final RateLimitMonitor rateLimitMonitor;
    private final RateLimiter localRateLimiter;
    private final ObjectMapper objectMapper;

    public WebClientCongressApiClient(WebClient webClient, CongressApiProperties properties,
                                      RateLimitMonitor rateLimitMonitor, RateLimiter localRateLimiter,
                                      ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.rateLimitMonitor = rateLimitMonitor;
        this.localRateLimiter = localRateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public CollectionPage fetchPage(String path, CollectionQuery query) {
        return CollectionPage.fromResponse(get(path, query.toParams()));
    }

    @Override
    public JsonNode fetchDetail(String path) {
        return get(path, Map.of());
    }

    private JsonNode get(String path, Map<String, String> params) {
        acquirePermit(path);
        rateLimitMonitor.recordRequest();
        try {
            ResponseEntity<String> response = webClient.get()
                    .uri(builder -> {
                        builder.path(path);
                        params.forEach((name, value) -> builder.queryParam(name, value));
                        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                            builder.queryParam("api_key", properties.getApiKey());
                        }
                        builder.queryParam("format", "json");
                        return builder.build();
                    })
                    .retrieve()
                    .toEntity(String.class)
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .block();
            if (response == null) {
                throw new CongressApiException(0, path, "Congress API returned no response for " + path);
            }
            recordRateLimitHeaders(response.getHeaders());
            return parse(path, response.getBody());
        } catch (WebClientResponseException e) {
            recordRateLimitHeaders(e.getHeaders());
            int status = e.getStatusCode().value();
            if (status == 429) {
                rateLimitMonitor.markRateLimitHit(retryAfter(e.getHeaders()));
            }
            throw new CongressApiException(status, path,
                    "Congress API " + status + " for " + path + ": " + snippet(e.getResponseBodyAsString()), e);
        } catch (WebClientRequestException e) {
            throw new CongressApiException(0, path, "Congress API unreachable for " + path + ": " + e.getMessage(), e);
        } catch (CongressApiException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new CongressApiException(408, path,
                        "Congress API timed out after " + properties.getTimeoutMs() + " ms for " + path, e);
            }
            throw e;
        }
    }

    private void acquirePermit(String path) {
        long acquireStart = System.nanoTime();
        boolean permitted = localRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new CongressApiException(0, path, "Local limiter timeout before " + path);
        }
        if (waitedMs >= 1_000L) {
            log.info("Local Congress API limiter delayed {} ms before {}", waitedMs, path);
        }
    }

    private JsonNode parse(String path, String body) {
        if (body == null || body.isBlank()) {
            throw new CongressApiException(0, path, "Congress API returned an empty body for " + path);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CongressApiException(0, path, "Congress API returned malformed JSON for " + path, e);
        }
    }

    private void recordRateLimitHeaders(HttpHeaders headers) {
        if (headers == null) {
            return;
        }
        Integer limit = parseInt(headers.getFirst("x-ratelimit-limit"));
        Integer remaining = parseInt(headers.getFirst("x-ratelimit-remaining"));
        Long reset = parseLong(headers.getFirst("x-ratelimit-reset"));
        if (limit != null || remaining != null || reset != null) {
            rateLimitMonitor.recordResponseHeaders(limit, remaining, reset);
        }
    }

    static Duration retryAfter(HttpHeaders headers) {
        Long seconds = headers != null ? parseLong(headers.getFirst(HttpHeaders.RETRY_AFTER)) : null;
        return seconds != null && seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    private static Integer parseInt(String value) {
        Long parsed = parseLong(value);
        return parsed != null && parsed <= Integer.MAX_VALUE ? parsed.intValue() : null;
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric header value {}", value);
            return null;
        }
    }

    private static String snippet(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= ERROR_BODY_SNIPPET ? body : body.substring(0, ERROR_BODY_SNIPPET) + "...";
    }
}
