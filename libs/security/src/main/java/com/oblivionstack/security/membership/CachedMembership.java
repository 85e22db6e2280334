package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.util.Set;

/**
 * One row of the {@link CachedMembershipView}: an active membership together with every role
 * the user holds across all of their active memberships.
 */
public record CachedMembership(UserId userId, BusinessId businessId, Role role, Set<Role> allRoles) {

    public CachedMembership {
        if (userId == null || businessId == null || role == null) {
            throw new IllegalArgumentException("userId, businessId and role must not be null");
        }
        allRoles = allRoles == null ? Set.of(role) : Set.copyOf(allRoles);
    }
}
