package com.oblivionstack.accessservice.api;

import com.oblivionstack.security.membership.Membership;
import java.time.Instant;

public record MembershipResponse(
        String businessId, String userId, String role, String status, Instant invitedAt, Instant joinedAt) {

    static MembershipResponse of(Membership membership) {
        return new MembershipResponse(
                membership.businessId().toString(),
                membership.userId().toString(),
                membership.role().value(),
                membership.status().value(),
                membership.invitedAt(),
                membership.joinedAt());
    }
}
