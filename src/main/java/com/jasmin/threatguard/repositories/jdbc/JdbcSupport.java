package com.jasmin.threatguard.repositories.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.threatguard.extractors.JsonUtils;
import com.jasmin.threatguard.models.CountByKey;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class JdbcSupport {
    private static final ObjectMapper OM = new ObjectMapper();

    static final RowMapper<CountByKey> COUNT_BY_KEY = (rs, i) ->
            new CountByKey(rs.getString("k"), rs.getLong("cnt"), rs.getLong("uniq"));

    private JdbcSupport() {
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp t = rs.getTimestamp(column);
        return t == null ? null : t.toInstant();
    }

    static long count(Long value) {
        return value == null ? 0L : value;
    }

    static String json(Object value) {
        return value == null ? null : JsonUtils.toJson(value);
    }

    static <T> List<T> list(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return OM.readValue(json, type);
        } catch (Exception e) {
            return List.of();
        }
    }

    static Map<String, Object> map(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return OM.readValue(json, new TypeReference<>() {});
        } catch (Exception e) {
            return Map.of();
        }
    }
}
