package com.oblivionstack.accessservice.domain;

import static com.oblivionstack.accessservice.domain.PolicyCatalog.AUDIT_LOGS;

import com.oblivionstack.audit.AuditLogReader;
import com.oblivionstack.audit.AuditRecord;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.policy.RowLevelGuard;
import java.util.List;

/** Audit trail reads, filtered by the {@code audit_logs} policies. */
public class AuditLogService {

    public static final int MAX_LIMIT = 500;

    private final AuditLogReader reader;
    private final RowLevelGuard guard;

    public AuditLogService(AuditLogReader reader, RowLevelGuard guard) {
        this.reader = reader;
        this.guard = guard;
    }

    /**
     * The business's most recent records, newest first, that the caller may read. Callers who are
     * not owners or admins there get an empty list.
     */
    public List<AuditRecord> recent(RequestContext context, BusinessId businessId, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return guard.visibleRows(context, AUDIT_LOGS, reader.findByBusiness(businessId, limit), TenancyRows::of);
    }
}
