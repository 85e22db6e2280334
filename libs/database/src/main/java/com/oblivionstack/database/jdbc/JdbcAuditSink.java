package com.oblivionstack.database.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oblivionstack.audit.AuditAction;
import com.oblivionstack.audit.AuditLogReader;
import com.oblivionstack.audit.AuditRecord;
import com.oblivionstack.audit.AuditRecordSerializer;
import com.oblivionstack.audit.AuditRecordSerializer.AuditSerializationException;
import com.oblivionstack.audit.AuditSink;
import com.oblivionstack.security.BusinessId;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Stores audit records in {@code audit_logs}. Row snapshots and the changed-field list are kept
 * as JSON text.
 */
public class JdbcAuditSink implements AuditSink, AuditLogReader {

    private static final ObjectMapper MAPPER = AuditRecordSerializer.objectMapper();
    private static final TypeReference<List<String>> FIELD_LIST = new TypeReference<>() {
    };

    private static final RowMapper<AuditRecord> ROW_MAPPER = JdbcAuditSink::mapRow;

    private final JdbcTemplate jdbc;

    public JdbcAuditSink(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void write(AuditRecord record) {
        jdbc.update("INSERT INTO audit_logs (id, table_name, record_id, action, user_id, business_id, old_data,"
                        + " new_data, changed_fields, ip_address, user_agent, request_id, created_at)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.id(),
                record.tableName(),
                record.recordId(),
                record.action().name(),
                record.userId(),
                record.businessId(),
                AuditRecordSerializer.writeRow(record.oldData()),
                AuditRecordSerializer.writeRow(record.newData()),
                writeFields(record.changedFields()),
                record.ipAddress(),
                record.userAgent(),
                record.requestId(),
                JdbcTimestamps.toDb(record.createdAt()));
    }

    @Override
    public List<AuditRecord> findByBusiness(BusinessId businessId, int limit) {
        return jdbc.query("SELECT * FROM audit_logs WHERE business_id = ? ORDER BY created_at DESC LIMIT ?",
                ROW_MAPPER, businessId.value(), limit);
    }

    private static String writeFields(List<String> fields) {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize changed fields", e);
        }
    }

    private static List<String> readFields(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, FIELD_LIST);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize changed fields", e);
        }
    }

    private static AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        String action = rs.getString("action");
        return new AuditRecord(
                rs.getObject("id", UUID.class),
                rs.getString("table_name"),
                rs.getString("record_id"),
                AuditAction.fromString(action).orElseThrow(() -> new SQLException("Unknown audit action: " + action)),
                rs.getObject("user_id", UUID.class),
                rs.getObject("business_id", UUID.class),
                AuditRecordSerializer.readRow(rs.getString("old_data")),
                AuditRecordSerializer.readRow(rs.getString("new_data")),
                readFields(rs.getString("changed_fields")),
                rs.getString("ip_address"),
                rs.getString("user_agent"),
                rs.getString("request_id"),
                JdbcTimestamps.fromDb(rs, "created_at"));
    }
}
