package com.deporacle.engine.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Lenient readers for loosely typed upstream JSON.
 *
 * @author Naveed Gung
 */
public final class JsonValues {

    private JsonValues() {
    }

    public static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /** ISO-8601 instant, or a zone-less local date-time taken as UTC. Null when unparsable. */
    public static Instant instantOrNull(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // PyPI's legacy upload_time carries no zone and is UTC
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                return null;
            }
        }
    }

    public static Instant instantOrNull(JsonNode node) {
        return instantOrNull(textOrNull(node));
    }
}
