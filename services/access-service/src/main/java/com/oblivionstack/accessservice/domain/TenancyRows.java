package com.oblivionstack.accessservice.domain;

import com.oblivionstack.audit.AuditRecord;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.policy.ResourceRow;
import com.oblivionstack.security.tenant.Business;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row views and audit snapshots of the tenancy entities.
 */
final class TenancyRows {

    private TenancyRows() {
        // utility class
    }

    static ResourceRow of(Business business) {
        return new ResourceRow(business.id(), null, Map.of("status", business.status().value()));
    }

    /** The member is the row's owner; the business is its tenant. */
    static ResourceRow of(Membership membership) {
        return new ResourceRow(membership.businessId(), membership.userId(),
                Map.of("role", membership.role().value(), "status", membership.status().value()));
    }

    static ResourceRow of(AuditRecord record) {
        return new ResourceRow(record.businessId() == null ? null : new BusinessId(record.businessId()), null,
                Map.of("table_name", record.tableName()));
    }

    static String recordId(Membership membership) {
        return membership.businessId() + "/" + membership.userId();
    }

    static Map<String, Object> snapshot(Business business) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", business.id().toString());
        row.put("name", business.name());
        row.put("slug", business.slug());
        row.put("industry", business.industry().value());
        row.put("email", business.email());
        row.put("status", business.status().value());
        row.put("subscription_tier", business.subscriptionTier().value());
        row.put("subscription_status", business.subscriptionStatus().value());
        row.put("deleted_at", business.deletedAt() == null ? null : business.deletedAt().toString());
        return row;
    }

    static Map<String, Object> snapshot(Membership membership) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("business_id", membership.businessId().toString());
        row.put("user_id", membership.userId().toString());
        row.put("role", membership.role().value());
        row.put("status", membership.status().value());
        row.put("invited_at", membership.invitedAt() == null ? null : membership.invitedAt().toString());
        row.put("joined_at", membership.joinedAt() == null ? null : membership.joinedAt().toString());
        return row;
    }
}
