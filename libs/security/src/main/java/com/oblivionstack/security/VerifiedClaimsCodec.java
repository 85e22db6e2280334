package com.oblivionstack.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Encodes and decodes {@link VerifiedClaims} for the {@code X-Verified-Claims} header the
 * gateway attaches after checking the bearer token: JSON, then URL-safe Base64 without padding.
 */
public final class VerifiedClaimsCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private VerifiedClaimsCodec() {
        // utility class
    }

    /**
     * Serializes claims to the header form.
     *
     * @throws ClaimsEncodingException if serialization fails
     */
    public static String encode(VerifiedClaims claims) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(claims);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (Exception e) {
            throw new ClaimsEncodingException("Failed to encode verified claims", e);
        }
    }

    /**
     * Parses the header form back to claims.
     *
     * @throws ClaimsEncodingException if the value is not Base64 or not a claims document
     */
    public static VerifiedClaims decode(String encoded) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(encoded.strip());
            return MAPPER.readValue(new String(json, StandardCharsets.UTF_8), VerifiedClaims.class);
        } catch (Exception e) {
            throw new ClaimsEncodingException("Failed to decode verified claims", e);
        }
    }

    /**
     * Decodes the header if present and well-formed; a missing or malformed header yields empty,
     * which the pipeline treats as an anonymous request.
     */
    public static Optional<VerifiedClaims> tryDecode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(encoded));
        } catch (ClaimsEncodingException e) {
            return Optional.empty();
        }
    }

    /** Thrown when claims cannot be encoded or decoded. */
    public static class ClaimsEncodingException extends RuntimeException {
        public ClaimsEncodingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
