package com.oblivionstack.security.tenant;

import java.util.Optional;

/**
 * Lifecycle status of a business.
 */
public enum BusinessStatus {

    TRIAL("trial"),
    ACTIVE("active"),
    SUSPENDED("suspended"),
    INACTIVE("inactive"),
    CANCELLED("cancelled");

    private final String value;

    BusinessStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Trial and active businesses are operating; the rest are frozen. */
    public boolean isOperating() {
        return this == TRIAL || this == ACTIVE;
    }

    public static Optional<BusinessStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (BusinessStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
