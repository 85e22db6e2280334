package com.oblivionstack.security.policy;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.UserId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The authorization-relevant view of a single row: the tenant it belongs to, the user who owns
 * it, and any further columns a custom predicate needs.
 *
 * @param businessId tenant the row is scoped to, null for rows without a tenant dimension
 * @param ownerId    user the row belongs to, null for rows without an owner
 * @param attributes further columns by name (never null); values may be null, as SQL NULL
 *                   columns are
 */
public record ResourceRow(BusinessId businessId, UserId ownerId, Map<String, Object> attributes) {

    public ResourceRow {
        attributes = attributes == null ? Map.of() : copyOf(attributes);
    }

    public static ResourceRow tenantScoped(BusinessId businessId) {
        return new ResourceRow(businessId, null, Map.of());
    }

    public static ResourceRow ownedBy(UserId ownerId) {
        return new ResourceRow(null, ownerId, Map.of());
    }

    /** A row with neither tenant nor owner, e.g. a reference-table row. */
    public static ResourceRow unscoped(Map<String, Object> attributes) {
        return new ResourceRow(null, null, attributes);
    }

    /** The column's value; empty when the column is absent or null. */
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((name, value) -> {
            if (name == null) {
                throw new IllegalArgumentException("attribute names must not be null");
            }
            copy.put(name, value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
