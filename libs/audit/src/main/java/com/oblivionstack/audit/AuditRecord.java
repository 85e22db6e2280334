package com.oblivionstack.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One audited mutation: who changed which row of which table, and how.
 *
 * @param id            unique record id
 * @param tableName     qualified name of the mutated table
 * @param recordId      id of the mutated row, null for TRUNCATE
 * @param action        kind of mutation
 * @param userId        acting user, null when the caller had no identity
 * @param businessId    tenant the row belongs to, null when unknown
 * @param oldData       row before the change (UPDATE, DELETE), redacted
 * @param newData       row after the change (INSERT, UPDATE), redacted
 * @param changedFields fields whose value differs between old and new data, sorted
 * @param ipAddress     client address from the request envelope
 * @param userAgent     client user agent from the request envelope
 * @param requestId     request or correlation id
 * @param createdAt     when the record was made
 */
public record AuditRecord(
        UUID id,
        String tableName,
        String recordId,
        AuditAction action,
        UUID userId,
        UUID businessId,
        Map<String, Object> oldData,
        Map<String, Object> newData,
        List<String> changedFields,
        String ipAddress,
        String userAgent,
        String requestId,
        Instant createdAt
) {

    public AuditRecord {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }
}
