package com.oblivionstack.accessservice.api;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.policy.ResourceRow;
import java.util.Map;

/**
 * A row as described by a caller asking for a decision.
 *
 * @param businessId tenant column, if the table has one
 * @param ownerId    owner column, if the table has one
 * @param attributes any further columns
 */
public record RowPayload(String businessId, String ownerId, Map<String, Object> attributes) {

    /**
     * @throws IllegalArgumentException if an id is present but not a UUID
     */
    public ResourceRow toRow() {
        return new ResourceRow(
                blank(businessId) ? null : BusinessId.of(businessId),
                blank(ownerId) ? null : UserId.of(ownerId),
                attributes);
    }

    static ResourceRow toRowOrEmpty(RowPayload payload) {
        return payload == null ? ResourceRow.unscoped(Map.of()) : payload.toRow();
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
