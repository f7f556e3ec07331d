package com.trialwatch.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson access shared by the JSON text column converters.
 */
final class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonColumns() {
    }

    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    static <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T value = MAPPER.readValue(json, type);
            return value == null ? fallback : value;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column value, using default: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
