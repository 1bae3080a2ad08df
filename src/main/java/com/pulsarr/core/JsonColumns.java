package com.pulsarr.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsarr.exception.PersistenceException;

import java.util.List;
import java.util.Map;

/**
 * JSON encoding of list and map columns.
 */
public final class JsonColumns {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonColumns() {
    }

    public static String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to encode JSON column", e);
        }
    }

    public static List<String> readStrings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return read(json, new TypeReference<List<String>>() {});
    }

    public static List<Integer> readIntegers(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return read(json, new TypeReference<List<Integer>>() {});
    }

    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return read(json, new TypeReference<Map<String, Object>>() {});
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to decode JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
