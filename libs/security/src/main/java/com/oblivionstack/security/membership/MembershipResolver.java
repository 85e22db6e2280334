package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Answers "which businesses may this caller touch, and in what role" from the authoritative
 * membership store.
 * <p>
 * Every method is a pure read over {@link MembershipRepository} and always reflects the current
 * membership state; revocations are visible on the next call. The nil identity short-circuits to
 * "no memberships" without touching the store.
 */
public class MembershipResolver {

    private final MembershipRepository repository;
    private final IdentityResolver identityResolver;

    public MembershipResolver(MembershipRepository repository, IdentityResolver identityResolver) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        if (identityResolver == null) {
            throw new IllegalArgumentException("identityResolver must not be null");
        }
        this.repository = repository;
        this.identityResolver = identityResolver;
    }

    /** Active memberships of the user. Empty for the nil sentinel. */
    public List<Membership> activeMemberships(UserId userId) {
        if (userId == null || userId.isNil()) {
            return List.of();
        }
        return repository.findByUser(userId).stream().filter(Membership::isActive).toList();
    }

    /** Businesses in which the caller holds an active membership. */
    public Set<BusinessId> activeBusinessIds(RequestContext context) {
        return activeBusinessIds(identityResolver.currentUserId(context));
    }

    /** Businesses in which {@code userId} holds an active membership. */
    public Set<BusinessId> activeBusinessIds(UserId userId) {
        return businessIdsOf(activeMemberships(userId), null);
    }

    /**
     * Businesses in which the caller holds an active membership whose role is exactly one of
     * {@code roles}. No hierarchy is applied: pass {@link Role#satisfiedBy()} for that.
     */
    public Set<BusinessId> activeBusinessIdsWithRole(RequestContext context, Set<Role> roles) {
        return businessIdsOf(activeMemberships(identityResolver.currentUserId(context)), roles);
    }

    /**
     * One business in which the caller holds an active membership.
     * <p>
     * When the caller belongs to several businesses, which one is returned is unspecified and may
     * differ between calls. Callers acting on a particular tenant must pass it explicitly and use
     * {@link #roleIn} or {@link #belongsToBusiness} instead.
     */
    public Optional<BusinessId> currentBusinessId(RequestContext context) {
        return activeMemberships(identityResolver.currentUserId(context)).stream()
                .map(Membership::businessId)
                .findFirst();
    }

    /** True iff the caller holds an active membership in {@code businessId}. */
    public boolean belongsToBusiness(RequestContext context, BusinessId businessId) {
        return roleIn(context, businessId).isPresent();
    }

    /** The caller's role in {@code businessId}, if their membership there is active. */
    public Optional<Role> roleIn(RequestContext context, BusinessId businessId) {
        UserId userId = identityResolver.currentUserId(context);
        if (businessId == null || userId.isNil()) {
            return Optional.empty();
        }
        return repository.find(businessId, userId)
                .filter(Membership::isActive)
                .map(Membership::role);
    }

    public IdentityResolver identityResolver() {
        return identityResolver;
    }

    static Set<BusinessId> businessIdsOf(List<Membership> memberships, Set<Role> roles) {
        Set<BusinessId> result = new LinkedHashSet<>();
        for (Membership membership : memberships) {
            if (roles == null || roles.contains(membership.role())) {
                result.add(membership.businessId());
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
