package com.oblivionstack.security.policy;

import com.oblivionstack.observability.MetricFactory;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.InMemoryMembershipRepository;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.testing.TestRequestContextFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RowLevelGuard")
class RowLevelGuardTest {

    private record Appointment(String id, BusinessId businessId, String notes) {
        ResourceRow toRow() {
            return ResourceRow.tenantScoped(businessId);
        }
    }

    /** A row object updated in place, as mutable entities are. */
    private static final class MutableAppointment {
        private BusinessId businessId;

        MutableAppointment(BusinessId businessId) {
            this.businessId = businessId;
        }

        ResourceRow toRow() {
            return ResourceRow.tenantScoped(businessId);
        }
    }

    private static final ProtectedResource APPOINTMENTS = ProtectedResource.table("appointments");

    private final BusinessId businessX = BusinessId.random();
    private final BusinessId businessY = BusinessId.random();
    private final InMemoryMembershipRepository repository = new InMemoryMembershipRepository();
    private RowLevelGuard guard;
    private List<Appointment> table;

    @BeforeEach
    void setUp() {
        PolicyRegistry registry = new PolicyRegistry();
        registry.applyTenantPolicies("public", "appointments", PolicyFlags.all());
        guard = new RowLevelGuard(new PolicyAuthorizer(registry,
                new MembershipResolver(repository, new IdentityResolver()),
                new MetricFactory(new SimpleMeterRegistry(), "authz")));
        table = List.of(
                new Appointment("a1", businessX, "trim"),
                new Appointment("a2", businessY, "colour"),
                new Appointment("a3", businessX, "wash"));
    }

    private RequestContext member(BusinessId business, Role role) {
        UserId user = UserId.random();
        repository.insert(Membership.active(business, user, role, Instant.now()));
        return TestRequestContextFactory.forUser(user);
    }

    @Test
    @DisplayName("select returns only rows of the caller's businesses, in order")
    void visibleRows() {
        List<Appointment> visible = guard.visibleRows(member(businessX, Role.STAFF), APPOINTMENTS, table, Appointment::toRow);

        assertThat(visible).extracting(Appointment::id).containsExactly("a1", "a3");
    }

    @Test
    @DisplayName("anonymous callers see nothing")
    void anonymousSeesNothing() {
        assertThat(guard.visibleRows(RequestContext.anonymous(), APPOINTMENTS, table, Appointment::toRow)).isEmpty();
    }

    @Test
    @DisplayName("writes by staff affect zero rows")
    void staffWritesAffectNothing() {
        RequestContext staff = member(businessX, Role.STAFF);

        assertThat(guard.affectedCount(staff, APPOINTMENTS, Operation.DELETE, table, Appointment::toRow)).isZero();
        assertThat(guard.updatableRows(staff, APPOINTMENTS, table, Appointment::toRow,
                a -> new Appointment(a.id(), a.businessId(), "changed"))).isEmpty();
        assertThat(guard.canInsert(staff, APPOINTMENTS, ResourceRow.tenantScoped(businessX))).isFalse();
    }

    @Test
    @DisplayName("an owner of X updates only the rows of X")
    void ownerUpdatesOwnRows() {
        RequestContext owner = member(businessX, Role.OWNER);

        List<Appointment> updated = guard.updatableRows(owner, APPOINTMENTS, table, Appointment::toRow,
                a -> new Appointment(a.id(), a.businessId(), "changed"));

        assertThat(updated).extracting(Appointment::id).containsExactly("a1", "a3");
        assertThat(updated).extracting(Appointment::notes).containsOnly("changed");
        assertThat(guard.affectedCount(owner, APPOINTMENTS, Operation.DELETE, table, Appointment::toRow)).isEqualTo(2);
    }

    @Test
    @DisplayName("an in-place change cannot move a foreign row into the caller's business")
    void inPlaceChangeCheckedAgainstOriginal() {
        RequestContext manager = member(businessX, Role.MANAGER);
        MutableAppointment foreign = new MutableAppointment(businessY);
        MutableAppointment own = new MutableAppointment(businessX);

        List<MutableAppointment> updated = guard.updatableRows(manager, APPOINTMENTS, List.of(foreign, own),
                MutableAppointment::toRow, a -> {
                    a.businessId = businessX;
                    return a;
                });

        assertThat(updated).containsExactly(own);
    }
}
