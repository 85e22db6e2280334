package com.oblivionstack.audit;

/**
 * Destination for audit records. A failing sink throws, so the mutation it audits can be rolled
 * back rather than left unaudited.
 */
public interface AuditSink {

    void write(AuditRecord record);
}
