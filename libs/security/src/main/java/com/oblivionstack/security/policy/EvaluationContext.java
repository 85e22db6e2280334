package com.oblivionstack.security.policy;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-decision (or per-statement) view of the caller that row predicates evaluate against.
 * <p>
 * Identity, trusted-service status and active memberships are resolved at most once and reused
 * for every row, so all rows of one statement see the same caller state. Not thread-safe; create
 * one per decision or statement.
 */
public final class EvaluationContext {

    private final RequestContext requestContext;
    private final IdentityResolver identityResolver;
    private final MembershipResolver membershipResolver;

    private UserId userId;
    private Boolean trustedService;
    private Map<BusinessId, Role> rolesByBusiness;

    public EvaluationContext(RequestContext requestContext, MembershipResolver membershipResolver) {
        if (membershipResolver == null) {
            throw new IllegalArgumentException("membershipResolver must not be null");
        }
        this.requestContext = requestContext == null ? RequestContext.anonymous() : requestContext;
        this.membershipResolver = membershipResolver;
        this.identityResolver = membershipResolver.identityResolver();
    }

    public RequestContext requestContext() {
        return requestContext;
    }

    public UserId userId() {
        if (userId == null) {
            userId = identityResolver.currentUserId(requestContext);
        }
        return userId;
    }

    public boolean isTrustedService() {
        if (trustedService == null) {
            trustedService = identityResolver.isTrustedService(requestContext);
        }
        return trustedService;
    }

    /** The caller's role in {@code businessId} if their membership there is active. */
    public Optional<Role> roleIn(BusinessId businessId) {
        if (businessId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(memberships().get(businessId));
    }

    public boolean belongsTo(BusinessId businessId) {
        return roleIn(businessId).isPresent();
    }

    public Set<BusinessId> activeBusinessIds() {
        return memberships().keySet();
    }

    private Map<BusinessId, Role> memberships() {
        if (rolesByBusiness == null) {
            Map<BusinessId, Role> resolved = new LinkedHashMap<>();
            for (Membership membership : membershipResolver.activeMemberships(userId())) {
                resolved.put(membership.businessId(), membership.role());
            }
            rolesByBusiness = Collections.unmodifiableMap(resolved);
        }
        return rolesByBusiness;
    }
}
