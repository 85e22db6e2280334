package com.oblivionstack.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Identifier of a business, the tenant isolation boundary.
 *
 * @param value the UUID of the business
 */
public record BusinessId(UUID value) {

    public BusinessId {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    /**
     * Parses a business ID.
     *
     * @throws IllegalArgumentException if {@code raw} is not a UUID
     */
    public static BusinessId of(String raw) {
        return parse(raw).orElseThrow(
                () -> new IllegalArgumentException("Not a valid business id: '%s'".formatted(raw)));
    }

    /** Parses a business ID, returning empty for null, blank or malformed input. */
    public static Optional<BusinessId> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BusinessId(UUID.fromString(raw.strip())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Generates a random business ID. */
    public static BusinessId random() {
        return new BusinessId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
