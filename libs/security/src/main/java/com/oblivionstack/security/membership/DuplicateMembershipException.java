package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.UserId;

/**
 * Thrown when a second membership is inserted for a (business, user) pair that already has one.
 */
public class DuplicateMembershipException extends RuntimeException {

    private final BusinessId businessId;
    private final UserId userId;

    public DuplicateMembershipException(BusinessId businessId, UserId userId) {
        super("User '%s' already has a membership in business '%s'".formatted(userId, businessId));
        this.businessId = businessId;
        this.userId = userId;
    }

    public BusinessId businessId() {
        return businessId;
    }

    public UserId userId() {
        return userId;
    }
}
