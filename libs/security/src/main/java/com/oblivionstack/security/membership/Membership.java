package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.time.Instant;

/**
 * A user's membership in one business: the join between user and business that carries the
 * role. At most one membership exists per (business, user) pair.
 *
 * @param businessId the business
 * @param userId     the member
 * @param role       the member's role in this business
 * @param status     lifecycle status; only ACTIVE confers access
 * @param invitedAt  when the invitation was issued, null for founding owners
 * @param joinedAt   when the membership became active, null while pending
 */
public record Membership(
        BusinessId businessId,
        UserId userId,
        Role role,
        MembershipStatus status,
        Instant invitedAt,
        Instant joinedAt
) {

    public Membership {
        if (businessId == null) {
            throw new IllegalArgumentException("businessId must not be null");
        }
        if (userId == null || userId.isNil()) {
            throw new IllegalArgumentException("userId must not be null or the nil sentinel");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    /** An active membership that was never an invitation (e.g. the founding owner). */
    public static Membership active(BusinessId businessId, UserId userId, Role role, Instant joinedAt) {
        return new Membership(businessId, userId, role, MembershipStatus.ACTIVE, null, joinedAt);
    }

    /** A pending invitation. */
    public static Membership pending(BusinessId businessId, UserId userId, Role role, Instant invitedAt) {
        return new Membership(businessId, userId, role, MembershipStatus.PENDING, invitedAt, null);
    }

    public boolean isActive() {
        return status.confersAccess();
    }

    /** Returns a copy in {@code newStatus}; becoming active for the first time stamps joinedAt. */
    public Membership withStatus(MembershipStatus newStatus, Instant at) {
        Instant joined = newStatus == MembershipStatus.ACTIVE && joinedAt == null ? at : joinedAt;
        return new Membership(businessId, userId, role, newStatus, invitedAt, joined);
    }

    public Membership withRole(Role newRole) {
        return new Membership(businessId, userId, newRole, status, invitedAt, joinedAt);
    }
}
