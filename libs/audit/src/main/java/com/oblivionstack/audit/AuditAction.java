package com.oblivionstack.audit;

import java.util.Optional;

/** Kind of mutation an audit record describes. */
public enum AuditAction {
    INSERT,
    UPDATE,
    DELETE,
    TRUNCATE;

    public static Optional<AuditAction> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AuditAction action : values()) {
            if (action.name().equalsIgnoreCase(value.strip())) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
