package com.oblivionstack.security.tenant;

import com.oblivionstack.security.BusinessId;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * A tenant: the isolation boundary that owns tenant-scoped rows.
 * <p>
 * Businesses are soft-deleted only. A business with {@code deletedAt} set is kept for history
 * and audit but is no longer a valid target for tenant-scoped rows.
 *
 * @param id                 business id
 * @param name               display name
 * @param slug               unique URL key, lower-case letters, digits and hyphens
 * @param industry           industry vertical
 * @param email              contact email
 * @param status             lifecycle status
 * @param subscriptionTier   plan
 * @param subscriptionStatus billing state
 * @param trialEndsAt        end of the trial period, null when not on trial
 * @param createdAt          creation time
 * @param updatedAt          last modification time
 * @param deletedAt          soft-delete marker, null while live
 */
public record Business(
        BusinessId id,
        String name,
        String slug,
        Industry industry,
        String email,
        BusinessStatus status,
        SubscriptionTier subscriptionTier,
        SubscriptionStatus subscriptionStatus,
        Instant trialEndsAt,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt
) {

    private static final Pattern SLUG = Pattern.compile("^[a-z0-9-]+$");

    public Business {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (!isValidSlug(slug)) {
            throw new IllegalArgumentException("slug must match ^[a-z0-9-]+$ but was: " + slug);
        }
        if (industry == null) {
            throw new IllegalArgumentException("industry must not be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        status = status == null ? BusinessStatus.TRIAL : status;
        subscriptionTier = subscriptionTier == null ? SubscriptionTier.BASIC : subscriptionTier;
        subscriptionStatus = subscriptionStatus == null ? SubscriptionStatus.TRIALING : subscriptionStatus;
    }

    /** A new business in trial on the basic tier. */
    public static Business newTrial(String name, String slug, Industry industry, String email, Instant now) {
        return new Business(BusinessId.random(), name, slug, industry, email, BusinessStatus.TRIAL,
                SubscriptionTier.BASIC, SubscriptionStatus.TRIALING, null, now, now, null);
    }

    public static boolean isValidSlug(String slug) {
        return slug != null && SLUG.matcher(slug).matches();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public Business softDeleted(Instant at) {
        return new Business(id, name, slug, industry, email, status, subscriptionTier, subscriptionStatus,
                trialEndsAt, createdAt, at, at);
    }

    public Business withStatus(BusinessStatus newStatus, Instant at) {
        return new Business(id, name, slug, industry, email, newStatus, subscriptionTier, subscriptionStatus,
                trialEndsAt, createdAt, at, deletedAt);
    }
}
