package net.cloudjob.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Map;

/** 시각은 epoch millis INTEGER, config 는 JSON TEXT 로 저장 */
public final class JdbcUtil {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private JdbcUtil() {}

    public static void setMillis(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.BIGINT);
        else ps.setLong(idx, i.toEpochMilli());
    }

    public static Instant getInstant(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }

    public static String toJson(Map<String, Object> config) throws SQLException {
        try {
            return JSON.writeValueAsString(config == null ? Map.of() : config);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize job config", e);
        }
    }

    public static Map<String, Object> fromJson(String json) throws SQLException {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return JSON.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid job config JSON", e);
        }
    }
}
