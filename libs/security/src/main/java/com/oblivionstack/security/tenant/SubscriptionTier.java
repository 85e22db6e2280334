package com.oblivionstack.security.tenant;

import java.util.Optional;

/** Subscription plan of a business. */
public enum SubscriptionTier {

    BASIC("basic"),
    ADVANCED("advanced"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SubscriptionTier> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SubscriptionTier candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
