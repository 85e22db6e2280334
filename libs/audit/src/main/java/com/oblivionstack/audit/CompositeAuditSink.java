package com.oblivionstack.audit;

import java.util.List;

/**
 * Writes every record to each delegate in order. The first failing delegate aborts the write.
 */
public class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> delegates;

    public CompositeAuditSink(List<AuditSink> delegates) {
        if (delegates == null || delegates.isEmpty()) {
            throw new IllegalArgumentException("delegates must not be null or empty");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void write(AuditRecord record) {
        for (AuditSink delegate : delegates) {
            delegate.write(record);
        }
    }
}
