package com.forge.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * SQL value conversion for ledger columns (UUID, name truncation, JSONB, timestamps).
 */
public final class LedgerSqlUtils {

    public static final int NAME_MAX_LEN = 255;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private LedgerSqlUtils() {}

    /**
     * Converts an execution id to a UUID. Non-UUID strings map to a deterministic name-based UUID.
     */
    public static UUID toUuid(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        try {
            return UUID.fromString(t);
        } catch (IllegalArgumentException notUuid) {
            return UUID.nameUUIDFromBytes(t.getBytes(StandardCharsets.UTF_8));
        }
    }

    /** Truncate to max length for name columns; null/blank returns null. */
    public static String toName(String s, int maxLen) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        return t.length() > maxLen ? t.substring(0, maxLen) : t;
    }

    /** Wrap a value as PG jsonb for a single ? placeholder; null stays SQL NULL. */
    public static PGobject toJsonb(Object value) throws SQLException {
        if (value == null) return null;
        return toJsonbPgObject(toJson(value));
    }

    /** Wrap an already serialized JSON string as PG jsonb. */
    public static PGobject toJsonbPgObject(String json) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json != null ? json : "{}");
        return o;
    }

    public static String toJson(Object value) throws SQLException {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize value to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> toMap(String json) throws SQLException {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot parse JSON column: " + e.getOriginalMessage(), e);
        }
    }

    public static List<String> toStringList(String json) throws SQLException {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot parse JSON column: " + e.getOriginalMessage(), e);
        }
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    public static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
