package com.civiclens.ingestion.adapter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for a paginated Congress.gov list endpoint.
 */
public record CollectionQuery(
        int offset,
        int limit,
        Instant fromDateTime,
        Instant toDateTime,
        String sort,
        Map<String, String> extraParams
) {

    public static final String UPDATE_DATE_ASC = "updateDate+asc";

    public CollectionQuery {
        extraParams = extraParams != null ? Map.copyOf(extraParams) : Map.of();
    }

    public static CollectionQuery page(int offset, int limit) {
        return new CollectionQuery(offset, limit, null, null, null, null);
    }

    public CollectionQuery from(Instant value) {
        return new CollectionQuery(offset, limit, value, toDateTime, sort, extraParams);
    }

    public CollectionQuery to(Instant value) {
        return new CollectionQuery(offset, limit, fromDateTime, value, sort, extraParams);
    }

    public CollectionQuery sortedBy(String value) {
        return new CollectionQuery(offset, limit, fromDateTime, toDateTime, value, extraParams);
    }

    public CollectionQuery param(String name, String value) {
        Map<String, String> params = new LinkedHashMap<>(extraParams);
        params.put(name, value);
        return new CollectionQuery(offset, limit, fromDateTime, toDateTime, sort, params);
    }

    public CollectionQuery atOffset(int value) {
        return new CollectionQuery(value, limit, fromDateTime, toDateTime, sort, extraParams);
    }

    /** Query parameters in upstream form (dates as yyyy-MM-ddTHH:mm:ssZ). */
    public Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("offset", String.valueOf(offset));
        params.put("limit", String.valueOf(limit));
        if (fromDateTime != null) {
            params.put("fromDateTime", formatDateTime(fromDateTime));
        }
        if (toDateTime != null) {
            params.put("toDateTime", formatDateTime(toDateTime));
        }
        if (sort != null) {
            params.put("sort", sort);
        }
        params.putAll(extraParams);
        return params;
    }

    public static String formatDateTime(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
