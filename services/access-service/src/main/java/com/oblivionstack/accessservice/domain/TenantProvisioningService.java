package com.oblivionstack.accessservice.domain;

import static com.oblivionstack.accessservice.domain.PolicyCatalog.BUSINESSES;
import static com.oblivionstack.accessservice.domain.PolicyCatalog.BUSINESS_USERS;

import com.oblivionstack.audit.AuditRecorder;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.HierarchicalAccessEvaluator;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.Permission;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.InvalidMembershipTransitionException;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipRepository;
import com.oblivionstack.security.membership.MembershipStatus;
import com.oblivionstack.security.policy.Operation;
import com.oblivionstack.security.policy.PolicyAuthorizer;
import com.oblivionstack.security.policy.RowLevelGuard;
import com.oblivionstack.security.tenant.Business;
import com.oblivionstack.security.tenant.BusinessRepository;
import com.oblivionstack.security.tenant.Industry;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Business and membership lifecycle: signup, invitation, acceptance, deactivation and soft delete.
 *
 * <p>Every mutation is authorized against the tenancy policies and audited. A target the caller
 * may not see or change is reported as {@link NotFoundException}. With a transaction manager in
 * the context each mutation and its audit records commit together; a failing audit write rolls
 * the mutation back.
 */
public class TenantProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(TenantProvisioningService.class);

    private final BusinessRepository businesses;
    private final MembershipRepository memberships;
    private final IdentityResolver identityResolver;
    private final HierarchicalAccessEvaluator hierarchy;
    private final PolicyAuthorizer authorizer;
    private final RowLevelGuard guard;
    private final AuditRecorder audit;
    private final Clock clock;

    public TenantProvisioningService(BusinessRepository businesses, MembershipRepository memberships,
                                     IdentityResolver identityResolver, HierarchicalAccessEvaluator hierarchy,
                                     PolicyAuthorizer authorizer, AuditRecorder audit, Clock clock) {
        this.businesses = businesses;
        this.memberships = memberships;
        this.identityResolver = identityResolver;
        this.hierarchy = hierarchy;
        this.authorizer = authorizer;
        this.guard = new RowLevelGuard(authorizer);
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Creates a business in trial and makes the caller its active owner.
     *
     * @throws AuthenticationRequiredException if the caller has no identity
     * @throws com.oblivionstack.security.tenant.DuplicateSlugException if the slug is taken
     */
    @Transactional
    public Business signup(RequestContext context, String name, String slug, Industry industry, String email) {
        UserId caller = requireUser(context);
        Instant now = clock.instant();
        Business business = Business.newTrial(name, slug, industry, email, now);
        businesses.insert(business);
        Membership owner = Membership.active(business.id(), caller, Role.OWNER, now);
        memberships.insert(owner);

        audit.inserted(context, BUSINESSES, business.id().toString(), business.id(), TenancyRows.snapshot(business));
        audit.inserted(context, BUSINESS_USERS, TenancyRows.recordId(owner), business.id(),
                TenancyRows.snapshot(owner));
        log.info("Business {} ({}) created by {}", business.id(), business.slug(), caller);
        return business;
    }

    /** The business, if it is not deleted and the caller is an active member. */
    public Business business(RequestContext context, BusinessId businessId) {
        return businesses.findActive(businessId)
                .filter(business -> authorizer.isAllowed(context, BUSINESSES, TenancyRows.of(business), Operation.SELECT))
                .orElseThrow(() -> notFound(businessId));
    }

    /** Soft-deletes the business. Only its owners may do so. */
    @Transactional
    public Business softDelete(RequestContext context, BusinessId businessId) {
        Business existing = business(context, businessId);
        Instant now = clock.instant();
        Business proposed = existing.softDeleted(now);
        if (authorizer.authorizeUpdate(context, BUSINESSES, TenancyRows.of(existing), TenancyRows.of(proposed)).denied()) {
            throw notFound(businessId);
        }
        Business deleted = businesses.softDelete(businessId, now).orElseThrow(() -> notFound(businessId));
        audit.updated(context, BUSINESSES, businessId.toString(), businessId,
                TenancyRows.snapshot(existing), TenancyRows.snapshot(deleted));
        log.info("Business {} soft-deleted", businessId);
        return deleted;
    }

    /**
     * The caller's active memberships joined with their businesses, most recently joined first.
     * Soft-deleted businesses are left out; an anonymous caller gets an empty list.
     */
    public List<UserBusiness> businessesOf(RequestContext context) {
        UserId caller = identityResolver.currentUserId(context);
        if (caller.isNil()) {
            return List.of();
        }
        return memberships.findByUser(caller).stream()
                .filter(Membership::isActive)
                .flatMap(membership -> businesses.findActive(membership.businessId())
                        .map(business -> new UserBusiness(business.id(), business.name(), membership.role(),
                                membership.joinedAt()))
                        .stream())
                .sorted(Comparator.comparing(UserBusiness::joinedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    /** Memberships of the business the caller may see; empty when they may see none. */
    public List<Membership> members(RequestContext context, BusinessId businessId) {
        return guard.visibleRows(context, BUSINESS_USERS, memberships.findByBusiness(businessId), TenancyRows::of);
    }

    /**
     * Invites {@code invitee} into the business with {@code role}. The caller needs write access to
     * {@code role} in the role hierarchy and the right to manage the business's members.
     *
     * @throws com.oblivionstack.security.membership.DuplicateMembershipException if the user
     *     already has a membership there, in any status
     */
    @Transactional
    public Membership invite(RequestContext context, BusinessId businessId, UserId invitee, Role role) {
        business(context, businessId);
        Membership pending = Membership.pending(businessId, invitee, role, clock.instant());
        boolean permitted = (identityResolver.isTrustedService(context)
                || hierarchy.check(context, businessId, role, Permission.WRITE))
                && guard.canInsert(context, BUSINESS_USERS, TenancyRows.of(pending));
        if (!permitted) {
            throw notFound(businessId);
        }
        memberships.insert(pending);
        audit.inserted(context, BUSINESS_USERS, TenancyRows.recordId(pending), businessId,
                TenancyRows.snapshot(pending));
        log.info("User {} invited to business {} as {}", invitee, businessId, role.value());
        return pending;
    }

    /** Activates the caller's own pending invitation to the business. */
    @Transactional
    public Membership accept(RequestContext context, BusinessId businessId) {
        UserId caller = requireUser(context);
        Membership invitation = memberships.find(businessId, caller)
                .filter(membership -> membership.status() == MembershipStatus.PENDING)
                .orElseThrow(() -> new NotFoundException("No pending invitation to business " + businessId));
        if (businesses.findActive(businessId).isEmpty()) {
            throw notFound(businessId);
        }
        Membership active = transition(invitation, MembershipStatus.ACTIVE);
        audit.updated(context, BUSINESS_USERS, TenancyRows.recordId(active), businessId,
                TenancyRows.snapshot(invitation), TenancyRows.snapshot(active));
        log.info("User {} joined business {}", caller, businessId);
        return active;
    }

    /**
     * Deactivates a member. The caller needs delete access to the member's role in the role
     * hierarchy and the right to manage the business's members.
     *
     * @throws InvalidMembershipTransitionException if the membership is already inactive
     */
    @Transactional
    public Membership deactivate(RequestContext context, BusinessId businessId, UserId member) {
        Membership existing = memberships.find(businessId, member)
                .filter(membership -> authorizer.isAllowed(context, BUSINESS_USERS, TenancyRows.of(membership),
                        Operation.SELECT))
                .orElseThrow(() -> new NotFoundException("No member " + member + " in business " + businessId));
        Membership proposed = existing.withStatus(MembershipStatus.INACTIVE, clock.instant());
        boolean permitted = (identityResolver.isTrustedService(context)
                || hierarchy.check(context, businessId, existing.role(), Permission.DELETE))
                && authorizer.authorizeUpdate(context, BUSINESS_USERS, TenancyRows.of(existing),
                        TenancyRows.of(proposed)).allowed();
        if (!permitted) {
            throw new NotFoundException("No member " + member + " in business " + businessId);
        }
        Membership inactive = transition(existing, MembershipStatus.INACTIVE);
        audit.updated(context, BUSINESS_USERS, TenancyRows.recordId(inactive), businessId,
                TenancyRows.snapshot(existing), TenancyRows.snapshot(inactive));
        log.info("Membership of {} in business {} deactivated", member, businessId);
        return inactive;
    }

    private Membership transition(Membership membership, MembershipStatus target) {
        if (!membership.status().canTransitionTo(target)) {
            throw new InvalidMembershipTransitionException(membership.status(), target);
        }
        return memberships.updateStatus(membership.businessId(), membership.userId(), membership.status(), target)
                .orElseThrow(() -> new NotFoundException("Membership vanished: " + TenancyRows.recordId(membership)));
    }

    private UserId requireUser(RequestContext context) {
        UserId caller = identityResolver.currentUserId(context);
        if (caller.isNil()) {
            throw new AuthenticationRequiredException("A verified user identity is required");
        }
        return caller;
    }

    private static NotFoundException notFound(BusinessId businessId) {
        return new NotFoundException("No business " + businessId);
    }
}
