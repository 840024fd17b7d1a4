package com.civiclens.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * One page of a list endpoint: the items plus upstream pagination. {@code body} keeps the whole response for
 * endpoints whose payload is not a plain array (bill subjects).
 */
public record CollectionPage(JsonNode body, List<JsonNode> items, Integer count, String next) {

    public CollectionPage {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }

    /**
     * Items are the first array-valued property of the body (e.g. "bills", "members", "actions").
     */
    public static CollectionPage fromResponse(JsonNode root) {
        List<JsonNode> items = new ArrayList<>();
        if (root != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray()) {
                    value.forEach(items::add);
                    break;
                }
            }
        }
        JsonNode pagination = root != null ? root.path("pagination") : null;
        Integer count = pagination != null && pagination.hasNonNull("count") ? pagination.get("count").asInt() : null;
        String next = pagination != null && pagination.hasNonNull("next") ? pagination.get("next").asText() : null;
        return new CollectionPage(root, items, count, next);
    }
}
