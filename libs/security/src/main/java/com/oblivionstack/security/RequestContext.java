package com.oblivionstack.security;

import java.util.Optional;

/**
 * The authenticated-request envelope for one request.
 * <p>
 * A {@code RequestContext} is created once per request by the pipeline and passed explicitly to
 * every authorization entry point. There is no process-wide "current user": code that has no
 * context in hand has no identity, and resolves to the nil sentinel.
 *
 * @param claims   verified token claims, or null for an unauthenticated request
 * @param metadata request metadata (never null; empty when unknown)
 */
public record RequestContext(VerifiedClaims claims, RequestMetadata metadata) {

    private static final RequestContext ANONYMOUS = new RequestContext(null, RequestMetadata.empty());

    public RequestContext {
        if (metadata == null) {
            metadata = RequestMetadata.empty();
        }
    }

    /** A context without identity. */
    public static RequestContext anonymous() {
        return ANONYMOUS;
    }

    /** A context carrying the given claims and no metadata. */
    public static RequestContext of(VerifiedClaims claims) {
        return new RequestContext(claims, RequestMetadata.empty());
    }

    /** The claims, if the request carried any. */
    public Optional<VerifiedClaims> claimsIfPresent() {
        return Optional.ofNullable(claims);
    }
}
