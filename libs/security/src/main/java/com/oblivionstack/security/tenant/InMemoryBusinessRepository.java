package com.oblivionstack.security.tenant;

import com.oblivionstack.security.BusinessId;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link BusinessRepository} backed by concurrent maps.
 */
public class InMemoryBusinessRepository implements BusinessRepository {

    private final ConcurrentMap<BusinessId, Business> businesses = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BusinessId> slugs = new ConcurrentHashMap<>();

    @Override
    public Optional<Business> findById(BusinessId id) {
        return Optional.ofNullable(businesses.get(id));
    }

    @Override
    public Optional<Business> findBySlug(String slug) {
        BusinessId id = slugs.get(slug);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public void insert(Business business) {
        if (slugs.putIfAbsent(business.slug(), business.id()) != null) {
            throw new DuplicateSlugException(business.slug());
        }
        businesses.put(business.id(), business);
    }

    @Override
    public Optional<Business> softDelete(BusinessId id, Instant at) {
        Business[] updated = {null};
        businesses.computeIfPresent(id, (key, existing) -> {
            if (existing.isDeleted()) {
                return existing;
            }
            updated[0] = existing.softDeleted(at);
            return updated[0];
        });
        return Optional.ofNullable(updated[0]);
    }
}
