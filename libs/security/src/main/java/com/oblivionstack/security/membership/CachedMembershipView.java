package com.oblivionstack.security.membership;

import com.oblivionstack.observability.MetricFactory;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Denormalized, periodically refreshed projection of active memberships keyed by
 * (user, business).
 * <p>
 * The view is <strong>not</strong> consistent with {@link MembershipRepository}: a revoked
 * membership stays visible here until the next {@link #refresh()}. It is meant for display
 * paths; authorization decisions go through {@link MembershipResolver}.
 * <p>
 * Readers always see a complete immutable snapshot and never wait on a refresh. A refresh
 * builds the next snapshot aside and swaps it in atomically. Only one rebuild runs at a time.
 * A refresh requested while another is in progress returns {@link RefreshOutcome#SKIPPED} at
 * once, and the refresh in progress rebuilds again before it returns, so every refresh request
 * is followed by a rebuild that starts after it.
 */
public class CachedMembershipView {

    private static final Logger log = LoggerFactory.getLogger(CachedMembershipView.class);

    /** Outcome of a {@link #refresh()} request. */
    public enum RefreshOutcome {
        REFRESHED,
        SKIPPED,
        FAILED
    }

    /**
     * @param outcome what happened
     * @param entries number of entries in the snapshot being served after the call
     * @param at      when the served snapshot was built, null if none has been built yet
     */
    public record RefreshResult(RefreshOutcome outcome, int entries, Instant at) {
    }

    private final MembershipRepository repository;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicBoolean rebuildRequested = new AtomicBoolean();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Timer refreshTimer;
    private final AtomicLong entriesGauge;

    public CachedMembershipView(MembershipRepository repository, MetricFactory metrics) {
        this(repository, metrics, Clock.systemUTC());
    }

    public CachedMembershipView(MembershipRepository repository, MetricFactory metrics, Clock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.repository = repository;
        this.clock = clock;
        this.refreshTimer = metrics.timer("membership.view.refresh", "Time to rebuild the cached membership view");
        this.entriesGauge = metrics.gauge("membership.view.entries", "Entries in the cached membership view");
    }

    /**
     * Rebuilds the view from the repository. Never throws: failures are logged and the previous
     * snapshot keeps being served.
     */
    public RefreshResult refresh() {
        rebuildRequested.set(true);
        RefreshResult last = null;
        while (rebuildRequested.get() && refreshLock.tryLock()) {
            try {
                while (rebuildRequested.getAndSet(false)) {
                    last = rebuild();
                }
            } finally {
                refreshLock.unlock();
            }
        }
        if (last == null) {
            log.debug("Membership view refresh already in progress, rebuild handed over");
            Snapshot current = snapshot.get();
            return new RefreshResult(RefreshOutcome.SKIPPED, current.size(), current.builtAt());
        }
        return last;
    }

    private RefreshResult rebuild() {
        try {
            Snapshot next = refreshTimer.record(() -> Snapshot.build(repository.findAllActive(), clock.instant()));
            snapshot.set(next);
            entriesGauge.set(next.size());
            log.info("Membership view refreshed with {} entries", next.size());
            return new RefreshResult(RefreshOutcome.REFRESHED, next.size(), next.builtAt());
        } catch (RuntimeException e) {
            Snapshot current = snapshot.get();
            log.error("Membership view refresh failed, still serving snapshot from {}", current.builtAt(), e);
            return new RefreshResult(RefreshOutcome.FAILED, current.size(), current.builtAt());
        }
    }

    public Optional<CachedMembership> find(UserId userId, BusinessId businessId) {
        return Optional.ofNullable(snapshot.get().byKey().get(new MembershipKey(businessId, userId)));
    }

    /** Businesses the user belonged to as of the last refresh. */
    public Set<BusinessId> businessIdsFor(UserId userId) {
        List<CachedMembership> rows = snapshot.get().byUser().getOrDefault(userId, List.of());
        Set<BusinessId> result = new LinkedHashSet<>();
        rows.forEach(row -> result.add(row.businessId()));
        return Collections.unmodifiableSet(result);
    }

    /** Members of the business as of the last refresh. */
    public List<CachedMembership> membersOf(BusinessId businessId) {
        return snapshot.get().byBusiness().getOrDefault(businessId, List.of());
    }

    /** All roles the user held across their active memberships as of the last refresh. */
    public Set<Role> rolesFor(UserId userId) {
        List<CachedMembership> rows = snapshot.get().byUser().getOrDefault(userId, List.of());
        return rows.isEmpty() ? Set.of() : rows.get(0).allRoles();
    }

    /** When the served snapshot was built; empty before the first refresh. */
    public Optional<Instant> refreshedAt() {
        return Optional.ofNullable(snapshot.get().builtAt());
    }

    public int size() {
        return snapshot.get().size();
    }

    private record Snapshot(
            Map<MembershipKey, CachedMembership> byKey,
            Map<UserId, List<CachedMembership>> byUser,
            Map<BusinessId, List<CachedMembership>> byBusiness,
            Instant builtAt
    ) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), null);

        static Snapshot build(List<Membership> memberships, Instant builtAt) {
            List<Membership> active = memberships.stream().filter(Membership::isActive).toList();
            Map<UserId, Set<Role>> rolesByUser = new HashMap<>();
            for (Membership membership : active) {
                rolesByUser.computeIfAbsent(membership.userId(), u -> EnumSet.noneOf(Role.class))
                        .add(membership.role());
            }

            Map<MembershipKey, CachedMembership> byKey = new HashMap<>();
            Map<UserId, List<CachedMembership>> byUser = new HashMap<>();
            Map<BusinessId, List<CachedMembership>> byBusiness = new HashMap<>();
            for (Membership membership : active) {
                CachedMembership row = new CachedMembership(
                        membership.userId(), membership.businessId(), membership.role(),
                        rolesByUser.get(membership.userId()));
                byKey.put(MembershipKey.of(membership), row);
                byUser.computeIfAbsent(row.userId(), u -> new ArrayList<>()).add(row);
                byBusiness.computeIfAbsent(row.businessId(), b -> new ArrayList<>()).add(row);
            }
            return new Snapshot(Map.copyOf(byKey), freeze(byUser), freeze(byBusiness), builtAt);
        }

        private static <K> Map<K, List<CachedMembership>> freeze(Map<K, List<CachedMembership>> source) {
            Map<K, List<CachedMembership>> copy = new HashMap<>();
            source.forEach((key, rows) -> copy.put(key, List.copyOf(rows)));
            return Map.copyOf(copy);
        }

        int size() {
            return byKey.size();
        }
    }
}
