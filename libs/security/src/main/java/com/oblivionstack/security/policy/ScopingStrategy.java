package com.oblivionstack.security.policy;

import java.util.Optional;

/** How rows of a protected resource are scoped to callers. */
public enum ScopingStrategy {

    /** Rows carry a business id; access follows membership and role in that business. */
    TENANT("tenant"),
    /** Rows carry an owner user id; only that user may access them. */
    OWNER("owner"),
    /** Rows are readable by anyone; writes need explicit rules. */
    PUBLIC_READ("public_read"),
    /** No template rules; only explicitly added rules (and the service bypass) apply. */
    CUSTOM("custom");

    private final String value;

    ScopingStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ScopingStrategy> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().replace('-', '_');
        for (ScopingStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
