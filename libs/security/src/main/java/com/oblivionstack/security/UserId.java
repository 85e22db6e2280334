package com.oblivionstack.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Identifier of an external identity (the JWT {@code sub} claim).
 * <p>
 * {@link #NIL} is the well-known sentinel returned when no valid identity is present. No
 * membership row can reference it, so every identity-based filter evaluated with it matches
 * nothing.
 *
 * @param value the UUID of the user
 */
public record UserId(UUID value) {

    /** The nil sentinel, {@code 00000000-0000-0000-0000-000000000000}. */
    public static final UserId NIL = new UserId(new UUID(0L, 0L));

    public UserId {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    /**
     * Parses a user ID.
     *
     * @throws IllegalArgumentException if {@code raw} is not a UUID
     */
    public static UserId of(String raw) {
        return parse(raw).orElseThrow(
                () -> new IllegalArgumentException("Not a valid user id: '%s'".formatted(raw)));
    }

    /** Parses a user ID, returning empty for null, blank or malformed input. */
    public static Optional<UserId> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new UserId(UUID.fromString(raw.strip())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Generates a random user ID. */
    public static UserId random() {
        return new UserId(UUID.randomUUID());
    }

    /** True for the nil sentinel. */
    public boolean isNil() {
        return NIL.value.equals(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
