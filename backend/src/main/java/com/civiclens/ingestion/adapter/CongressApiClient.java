package com.civiclens.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Remote collection fetch capability over Congress.gov v3. Implementations account every request against
 * the shared RateLimitMonitor.
 *
 * @throws CongressApiException on any upstream or transport failure
 */
public interface CongressApiClient {

    /** List endpoint, e.g. {@code /bill/119} or {@code /bill/119/hr/1/actions}. */
    CollectionPage fetchPage(String path, CollectionQuery query);

    /** Detail endpoint; returns the whole response body. */
    JsonNode fetchDetail(String path);
}
