package com.oblivionstack.security;

import java.util.Optional;

/**
 * Permissions requested in cross-role management checks, e.g. a manager editing the record of a
 * staff member. See {@link HierarchicalAccessRules}.
 */
public enum Permission {

    READ("read"),
    WRITE("write"),
    DELETE("delete"),
    /** Reserved for actions only a business owner may take (ownership transfer, closure). */
    OWNER_ONLY("owner_only");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Looks up a permission by its canonical value, ignoring case. */
    public static Optional<Permission> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Permission permission : values()) {
            if (permission.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
