package com.oblivionstack.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record as one JSON line to the {@code AUDIT} logger, for shipping by the log
 * pipeline.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "AUDIT";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void write(AuditRecord record) {
        audit.info("{}", AuditRecordSerializer.serialize(record));
    }
}
