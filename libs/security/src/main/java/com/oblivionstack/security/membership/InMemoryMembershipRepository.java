package com.oblivionstack.security.membership;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link MembershipRepository} backed by a concurrent map. Suitable for tests and for
 * deployments where memberships are mirrored from another system.
 */
public class InMemoryMembershipRepository implements MembershipRepository {

    private final ConcurrentMap<MembershipKey, Membership> memberships = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMembershipRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryMembershipRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<Membership> findByUser(UserId userId) {
        return memberships.values().stream()
                .filter(m -> m.userId().equals(userId))
                .toList();
    }

    @Override
    public List<Membership> findByBusiness(BusinessId businessId) {
        return memberships.values().stream()
                .filter(m -> m.businessId().equals(businessId))
                .toList();
    }

    @Override
    public Optional<Membership> find(BusinessId businessId, UserId userId) {
        return Optional.ofNullable(memberships.get(new MembershipKey(businessId, userId)));
    }

    @Override
    public List<Membership> findAllActive() {
        return memberships.values().stream().filter(Membership::isActive).toList();
    }

    @Override
    public void insert(Membership membership) {
        if (memberships.putIfAbsent(MembershipKey.of(membership), membership) != null) {
            throw new DuplicateMembershipException(membership.businessId(), membership.userId());
        }
    }

    @Override
    public Optional<Membership> updateStatus(BusinessId businessId, UserId userId,
                                             MembershipStatus expected, MembershipStatus target) {
        return Optional.ofNullable(memberships.computeIfPresent(
                new MembershipKey(businessId, userId),
                (key, existing) -> {
                    if (existing.status() != expected) {
                        throw new InvalidMembershipTransitionException(existing.status(), target);
                    }
                    return existing.withStatus(target, clock.instant());
                }));
    }

    @Override
    public Optional<Membership> updateRole(BusinessId businessId, UserId userId, Role role) {
        return Optional.ofNullable(memberships.computeIfPresent(
                new MembershipKey(businessId, userId),
                (key, existing) -> existing.withRole(role)));
    }

    /** Removes every membership. */
    public void clear() {
        memberships.clear();
    }
}
