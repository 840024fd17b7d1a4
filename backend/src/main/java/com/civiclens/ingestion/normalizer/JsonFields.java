package com.civiclens.ingestion.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Lenient readers for Congress.gov JSON. Missing, null and blank values read as null.
 */
final class JsonFields {

    private JsonFields() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isInt() || value.isLong()) {
            return value.asInt();
        }
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " is not a number: " + text, e);
        }
    }

    static int requiredInt(JsonNode node, String field) {
        Integer value = integer(node, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing required field " + field);
        }
        return value;
    }

    static String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing required field " + field);
        }
        return value;
    }

    /** Accepts yyyy-MM-dd or a full timestamp (date part kept). */
    static LocalDate localDate(JsonNode node, String field) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        try {
            return text.length() > 10 ? OffsetDateTime.parse(text).toLocalDate() : LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Field " + field + " is not a date: " + text, e);
        }
    }

    /** Accepts a timestamp with offset or a bare date (start of day UTC). */
    static Instant instant(JsonNode node, String field) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Field " + field + " is not a timestamp: " + text, e);
        }
    }

    /** Later of two instants, null-tolerant. */
    static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
