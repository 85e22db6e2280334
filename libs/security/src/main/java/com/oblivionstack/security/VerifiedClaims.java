package com.oblivionstack.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Optional;

/**
 * Claims of a bearer token that the upstream gateway has already verified.
 * <p>
 * Field names follow the JWT claim names so the gateway can forward its decoded payload as-is.
 *
 * @param subject              {@code sub}: the user id (a UUID for end users)
 * @param email                {@code email}: optional email address
 * @param principalRole        {@code role}: the principal class, e.g. {@code authenticated},
 *                             {@code anon} or the trusted service principal
 * @param expiresAtEpochSecond {@code exp}: expiry in epoch seconds, or null for no expiry
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifiedClaims(
        @JsonProperty("sub") String subject,
        @JsonProperty("email") String email,
        @JsonProperty("role") String principalRole,
        @JsonProperty("exp") Long expiresAtEpochSecond
) {

    /** Claims for an end user without an expiry. */
    public static VerifiedClaims forUser(UserId userId, String email) {
        return new VerifiedClaims(userId.toString(), email, "authenticated", null);
    }

    /** The expiry instant, if the token carries one. */
    public Optional<Instant> expiresAt() {
        return Optional.ofNullable(expiresAtEpochSecond).map(Instant::ofEpochSecond);
    }

    /** True when the claims carry an expiry at or before {@code now}. */
    public boolean isExpiredAt(Instant now) {
        return expiresAtEpochSecond != null && !now.isBefore(Instant.ofEpochSecond(expiresAtEpochSecond));
    }
}
