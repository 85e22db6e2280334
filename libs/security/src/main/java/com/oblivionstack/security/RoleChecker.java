package com.oblivionstack.security;

import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import java.util.Arrays;
import java.util.List;

/**
 * Role checks against the caller's live memberships.
 * <p>
 * {@link #hasRole} passes when any of the caller's active memberships holds a role that
 * {@linkplain Role#satisfies satisfies} the requirement, in whichever business that membership
 * is. Use {@link #hasRoleIn} when the check must be confined to a single tenant.
 */
public class RoleChecker {

    private final MembershipResolver membershipResolver;

    public RoleChecker(MembershipResolver membershipResolver) {
        if (membershipResolver == null) {
            throw new IllegalArgumentException("membershipResolver must not be null");
        }
        this.membershipResolver = membershipResolver;
    }

    public boolean hasRole(RequestContext context, Role required) {
        if (required == null) {
            return false;
        }
        UserId userId = membershipResolver.identityResolver().currentUserId(context);
        List<Membership> memberships = membershipResolver.activeMemberships(userId);
        return memberships.stream().anyMatch(m -> m.role().satisfies(required));
    }

    /** True if {@link #hasRole} passes for at least one of {@code required}. */
    public boolean hasAnyRole(RequestContext context, Role... required) {
        return Arrays.stream(required).anyMatch(role -> hasRole(context, role));
    }

    /** True iff the caller's active role in {@code businessId} satisfies {@code required}. */
    public boolean hasRoleIn(RequestContext context, BusinessId businessId, Role required) {
        return membershipResolver.roleIn(context, businessId)
                .map(actual -> actual.satisfies(required))
                .orElse(false);
    }
}
