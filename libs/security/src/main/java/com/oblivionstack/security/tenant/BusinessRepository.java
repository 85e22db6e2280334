package com.oblivionstack.security.tenant;

import com.oblivionstack.security.BusinessId;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage for businesses. Soft-deleted businesses stay retrievable by {@link #findById}.
 */
public interface BusinessRepository {

    Optional<Business> findById(BusinessId id);

    /** The business if it exists and has not been soft-deleted. */
    default Optional<Business> findActive(BusinessId id) {
        return findById(id).filter(business -> !business.isDeleted());
    }

    Optional<Business> findBySlug(String slug);

    /**
     * @throws DuplicateSlugException if the slug is taken
     */
    void insert(Business business);

    /**
     * Marks the business deleted.
     *
     * @return the updated business, empty if unknown or already deleted
     */
    Optional<Business> softDelete(BusinessId id, Instant at);
}
