package com.oblivionstack.security.tenant;

import java.util.Optional;

/** Billing state of a business subscription. */
public enum SubscriptionStatus {

    ACTIVE("active"),
    CANCELLED("cancelled"),
    PAST_DUE("past_due"),
    TRIALING("trialing"),
    PAUSED("paused");

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SubscriptionStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SubscriptionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
