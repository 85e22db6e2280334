package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.UserId;

/** The (business, user) pair that identifies a membership. */
record MembershipKey(BusinessId businessId, UserId userId) {

    static MembershipKey of(Membership membership) {
        return new MembershipKey(membership.businessId(), membership.userId());
    }
}
