package io.hivestore.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return COMPACT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    /**
     * Column values holding id or capability lists are JSON arrays; a null or blank column reads as empty.
     */
    public static String toStringListJson(List<String> values) {
        return toCompactJson(values == null ? List.of() : values);
    }

    public static List<String> fromStringListJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(COMPACT_MAPPER.readValue(raw, STRING_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON list column: " + raw, e);
        }
    }
}
