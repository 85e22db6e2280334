package com.oblivionstack.accessservice.domain;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import java.time.Instant;

/**
 * One business a user is an active member of, as listed to that user.
 *
 * @param joinedAt when the membership became active, null for rows activated without a stamp
 */
public record UserBusiness(BusinessId businessId, String businessName, Role role, Instant joinedAt) {
}
