package com.oblivionstack.security;

import com.oblivionstack.security.membership.MembershipResolver;
import java.util.Optional;

/**
 * Evaluates {@link HierarchicalAccessRules} against the caller's role in a tenant.
 */
public class HierarchicalAccessEvaluator {

    private final MembershipResolver membershipResolver;

    public HierarchicalAccessEvaluator(MembershipResolver membershipResolver) {
        if (membershipResolver == null) {
            throw new IllegalArgumentException("membershipResolver must not be null");
        }
        this.membershipResolver = membershipResolver;
    }

    /**
     * Checks the caller's role in {@link MembershipResolver#currentBusinessId}. For callers with
     * several active tenants the tenant consulted is unspecified; prefer
     * {@link #check(RequestContext, BusinessId, Role, Permission)}.
     */
    public boolean check(RequestContext context, Role target, Permission permission) {
        Optional<BusinessId> business = membershipResolver.currentBusinessId(context);
        return business.isPresent() && check(context, business.get(), target, permission);
    }

    /** Checks the caller's role in {@code businessId}. Denies when the caller is not an active member. */
    public boolean check(RequestContext context, BusinessId businessId, Role target, Permission permission) {
        return membershipResolver.roleIn(context, businessId)
                .map(actor -> HierarchicalAccessRules.permits(actor, target, permission))
                .orElse(false);
    }
}
