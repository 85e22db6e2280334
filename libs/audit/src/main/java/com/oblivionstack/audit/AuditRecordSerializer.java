package com.oblivionstack.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/**
 * JSON serialization for {@link AuditRecord}s and their row snapshots. Instants are written
 * as ISO-8601 strings.
 */
public final class AuditRecordSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private AuditRecordSerializer() {
        // utility class
    }

    /**
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit record: " + record.id(), e);
        }
    }

    /**
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuditRecord deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditRecord.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit record", e);
        }
    }

    /** Serializes a row snapshot; null stays null. */
    public static String writeRow(Map<String, Object> row) {
        if (row == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize row snapshot", e);
        }
    }

    /** Parses a row snapshot; null stays null. */
    public static Map<String, Object> readRow(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json, ROW_TYPE);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize row snapshot", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Thrown when an audit record or row snapshot cannot be (de)serialized. */
    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
