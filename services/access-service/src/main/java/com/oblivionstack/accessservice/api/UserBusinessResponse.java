package com.oblivionstack.accessservice.api;

import com.oblivionstack.accessservice.domain.UserBusiness;
import java.time.Instant;

public record UserBusinessResponse(String businessId, String businessName, String role, Instant joinedAt) {

    static UserBusinessResponse of(UserBusiness business) {
        return new UserBusinessResponse(
                business.businessId().toString(),
                business.businessName(),
                business.role().value(),
                business.joinedAt());
    }
}
