package com.acme.delivery.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.HashMap;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new PermanentException("Cannot serialize " + typeName(o) + " to JSON", e);
        }
    }

    /**
     * Reads JSON into the given type.
     *
     * @throws PoisonMessageException when the text is not valid JSON for the type
     */
    public static <T> T fromJson(String json, Class<T> clazz) {
        if (json == null) {
            throw new PoisonMessageException("Cannot deserialize null JSON to " + clazz.getSimpleName());
        }
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new PoisonMessageException(
                    "Cannot deserialize JSON to " + clazz.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public static Map<String, Object> toObjectMap(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return M.readValue(json, OBJECT_MAP);
        } catch (Exception e) {
            throw new PoisonMessageException("Cannot deserialize JSON object: " + e.getMessage(), e);
        }
    }

    public static Map<String, String> toStringMap(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return M.readValue(json, STRING_MAP);
        } catch (Exception e) {
            throw new PoisonMessageException("Cannot deserialize JSON object: " + e.getMessage(), e);
        }
    }

    public static Map<String, String> merge(Map<String, String> a, Map<String, String> b) {
        var m = new HashMap<String, String>();
        m.putAll(a);
        m.putAll(b);
        return m;
    }

    private static String typeName(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName();
    }
}
