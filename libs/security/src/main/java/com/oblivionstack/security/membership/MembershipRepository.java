package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.util.List;
import java.util.Optional;

/**
 * Storage for memberships ({@code business_users}). Implementations must be safe for concurrent
 * readers; every read reflects committed state at the time of the call.
 */
public interface MembershipRepository {

    /** All memberships of the user, in any status. Iteration order is unspecified. */
    List<Membership> findByUser(UserId userId);

    /** All memberships of the business, in any status. */
    List<Membership> findByBusiness(BusinessId businessId);

    Optional<Membership> find(BusinessId businessId, UserId userId);

    /** Every active membership across all businesses. Used to rebuild the cached view. */
    List<Membership> findAllActive();

    /**
     * Stores a new membership.
     *
     * @throws DuplicateMembershipException if the pair already has a membership
     */
    void insert(Membership membership);

    /**
     * Moves an existing membership from {@code expected} to {@code target} in one atomic step.
     *
     * @return the updated membership, or empty if the pair has none
     * @throws InvalidMembershipTransitionException if the stored status is no longer
     *     {@code expected}; nothing is written
     */
    Optional<Membership> updateStatus(BusinessId businessId, UserId userId,
                                      MembershipStatus expected, MembershipStatus target);

    /**
     * Overwrites the role of an existing membership.
     *
     * @return the updated membership, or empty if the pair has none
     */
    Optional<Membership> updateRole(BusinessId businessId, UserId userId, Role role);
}
