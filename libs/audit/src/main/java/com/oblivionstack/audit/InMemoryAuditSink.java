package com.oblivionstack.audit;

import com.oblivionstack.security.BusinessId;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps audit records in memory. Intended for tests and local runs.
 */
public class InMemoryAuditSink implements AuditSink, AuditLogReader {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void write(AuditRecord record) {
        records.add(record);
    }

    @Override
    public List<AuditRecord> findByBusiness(BusinessId businessId, int limit) {
        return records.stream()
                .filter(r -> businessId.value().equals(r.businessId()))
                .sorted(Comparator.comparing(AuditRecord::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    public List<AuditRecord> records() {
        return List.copyOf(records);
    }

    public List<AuditRecord> recordsFor(String tableName) {
        return records.stream().filter(r -> r.tableName().equals(tableName)).toList();
    }

    public void clear() {
        records.clear();
    }
}
