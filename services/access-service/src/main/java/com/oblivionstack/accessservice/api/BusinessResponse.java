package com.oblivionstack.accessservice.api;

import com.oblivionstack.security.tenant.Business;
import java.time.Instant;

public record BusinessResponse(
        String id,
        String name,
        String slug,
        String industry,
        String email,
        String status,
        String subscriptionTier,
        String subscriptionStatus,
        Instant createdAt,
        Instant deletedAt) {

    static BusinessResponse of(Business business) {
        return new BusinessResponse(
                business.id().toString(),
                business.name(),
                business.slug(),
                business.industry().value(),
                business.email(),
                business.status().value(),
                business.subscriptionTier().value(),
                business.subscriptionStatus().value(),
                business.createdAt(),
                business.deletedAt());
    }
}
