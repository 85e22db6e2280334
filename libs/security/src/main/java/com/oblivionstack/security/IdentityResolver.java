package com.oblivionstack.security;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the caller identity from a {@link RequestContext}.
 * <p>
 * Resolution never throws. Missing claims, a blank or non-UUID subject, and expired claims all
 * resolve to {@link UserId#NIL}, which no membership references, so every predicate built on the
 * identity denies. The result depends only on the context and the clock, so it is stable for the
 * duration of a single decision.
 */
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    /** Principal-role claim value of the trusted backend service. */
    public static final String DEFAULT_TRUSTED_SERVICE_PRINCIPAL = "service_role";

    private final Clock clock;
    private final String trustedServicePrincipal;

    public IdentityResolver() {
        this(Clock.systemUTC(), DEFAULT_TRUSTED_SERVICE_PRINCIPAL);
    }

    /**
     * @param clock                   clock used for claim expiry
     * @param trustedServicePrincipal principal-role claim that identifies the trusted service
     */
    public IdentityResolver(Clock clock, String trustedServicePrincipal) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (trustedServicePrincipal == null || trustedServicePrincipal.isBlank()) {
            throw new IllegalArgumentException("trustedServicePrincipal must not be null or blank");
        }
        this.clock = clock;
        this.trustedServicePrincipal = trustedServicePrincipal;
    }

    /**
     * Returns the caller's user id, or {@link UserId#NIL} when no valid identity is present.
     */
    public UserId currentUserId(RequestContext context) {
        if (context == null || context.claims() == null) {
            return UserId.NIL;
        }
        VerifiedClaims claims = context.claims();
        if (claims.isExpiredAt(clock.instant())) {
            log.debug("Claims for subject {} expired at {}", claims.subject(), claims.expiresAt().orElse(null));
            return UserId.NIL;
        }
        return UserId.parse(claims.subject()).orElse(UserId.NIL);
    }

    /** True when the context resolves to a real (non-sentinel) user. */
    public boolean isAuthenticated(RequestContext context) {
        return !currentUserId(context).isNil();
    }

    /**
     * True when the context carries unexpired claims of the trusted service principal. Only
     * resources with an explicit service bypass policy honour this.
     */
    public boolean isTrustedService(RequestContext context) {
        if (context == null || context.claims() == null) {
            return false;
        }
        VerifiedClaims claims = context.claims();
        return trustedServicePrincipal.equals(claims.principalRole())
                && !claims.isExpiredAt(clock.instant());
    }

    public String trustedServicePrincipal() {
        return trustedServicePrincipal;
    }
}
