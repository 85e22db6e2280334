package com.oblivionstack.audit;

import com.oblivionstack.security.BusinessId;
import java.util.List;

/**
 * Read access to stored audit records. Results are not filtered by caller; apply the
 * {@code audit_logs} policies before returning them.
 */
public interface AuditLogReader {

    /** Most recent records of the business first, at most {@code limit}. */
    List<AuditRecord> findByBusiness(BusinessId businessId, int limit);
}
