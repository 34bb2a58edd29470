package com.jasmin.threatguard.extractors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

public class JsonUtils {
    private static final ObjectMapper M = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static String toJson(Object value) {
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        try {
            return M.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /** Truncates to {@code maxChars} characters, keeping stored snapshots bounded. */
    public static String toJsonTruncated(Object value, int maxChars) {
        String s = toJson(value);
        if (s == null || s.length() <= maxChars) return s;
        return s.substring(0, maxChars);
    }

    /** Parses a JSON object body; returns null for anything that is not a JSON object. */
    public static Map<String, Object> parseObject(byte[] body) {
        if (body == null || body.length == 0) return null;
        try {
            return M.readValue(body, new TypeReference<>() {});
        } catch (Exception e) {
            return null;
        }
    }
}
