package com.oblivionstack.database.jdbc;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.DuplicateMembershipException;
import com.oblivionstack.security.membership.InvalidMembershipTransitionException;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.membership.MembershipStatus;
import com.oblivionstack.security.tenant.Business;
import com.oblivionstack.security.tenant.Industry;
import com.oblivionstack.security.testing.TestRequestContextFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JdbcMembershipRepository")
class JdbcMembershipRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private H2TenancyDatabase database;
    private JdbcMembershipRepository repository;
    private BusinessId businessX;
    private BusinessId businessY;
    private final UserId user = UserId.random();

    @BeforeEach
    void setUp() {
        database = new H2TenancyDatabase();
        repository = new JdbcMembershipRepository(database.jdbc(), Clock.fixed(NOW, ZoneOffset.UTC));
        JdbcBusinessRepository businesses = new JdbcBusinessRepository(database.jdbc());
        Business x = Business.newTrial("Shop X", "shop-x", Industry.SALONS_BARBERSHOPS, "x@shop.test", NOW);
        Business y = Business.newTrial("Shop Y", "shop-y", Industry.AUTO_MECHANICS, "y@shop.test", NOW);
        businesses.insert(x);
        businesses.insert(y);
        businessX = x.id();
        businessY = y.id();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("stores and reads memberships with their timestamps")
    void insertAndFind() {
        Membership membership = Membership.active(businessX, user, Role.MANAGER, NOW.minusSeconds(60));
        repository.insert(membership);

        assertThat(repository.find(businessX, user)).contains(membership);
        assertThat(repository.findByUser(user)).containsExactly(membership);
        assertThat(repository.findByBusiness(businessX)).containsExactly(membership);
    }

    @Test
    @DisplayName("enforces one membership per business and user")
    void uniquePair() {
        repository.insert(Membership.active(businessX, user, Role.STAFF, NOW));

        assertThatThrownBy(() -> repository.insert(Membership.pending(businessX, user, Role.ADMIN, NOW)))
                .isInstanceOf(DuplicateMembershipException.class);
    }

    @Nested
    @DisplayName("status changes")
    class StatusChanges {

        @Test
        @DisplayName("accepting an invitation activates it and stamps joinedAt")
        void accept() {
            repository.insert(Membership.pending(businessX, user, Role.STAFF, NOW.minusSeconds(3600)));

            Membership active = repository.updateStatus(businessX, user, MembershipStatus.PENDING, MembershipStatus.ACTIVE).orElseThrow();

            assertThat(active.joinedAt()).isEqualTo(NOW);
            assertThat(repository.findAllActive()).containsExactly(active);
        }

        @Test
        @DisplayName("deactivation is visible to the resolver on the next call")
        void deactivationVisibleImmediately() {
            repository.insert(Membership.active(businessX, user, Role.OWNER, NOW));
            MembershipResolver resolver = new MembershipResolver(repository, new IdentityResolver());
            var context = TestRequestContextFactory.forUser(user);
            assertThat(resolver.belongsToBusiness(context, businessX)).isTrue();

            repository.updateStatus(businessX, user, MembershipStatus.ACTIVE, MembershipStatus.INACTIVE);

            assertThat(resolver.belongsToBusiness(context, businessX)).isFalse();
            assertThat(resolver.activeBusinessIds(context)).isEmpty();
        }

        @Test
        @DisplayName("only updates a row still in the expected status")
        void compareAndSet() {
            repository.insert(Membership.pending(businessX, user, Role.STAFF, NOW));
            repository.updateStatus(businessX, user, MembershipStatus.PENDING, MembershipStatus.INACTIVE);

            assertThatThrownBy(() -> repository.updateStatus(businessX, user,
                    MembershipStatus.PENDING, MembershipStatus.ACTIVE))
                    .isInstanceOf(InvalidMembershipTransitionException.class);
            assertThat(repository.find(businessX, user)).get()
                    .satisfies(m -> {
                        assertThat(m.status()).isEqualTo(MembershipStatus.INACTIVE);
                        assertThat(m.joinedAt()).isNull();
                    });
        }

        @Test
        @DisplayName("unknown pairs are reported as empty")
        void unknown() {
            assertThat(repository.updateStatus(businessY, user, MembershipStatus.PENDING, MembershipStatus.ACTIVE)).isEmpty();
            assertThat(repository.updateRole(businessY, user, Role.ADMIN)).isEmpty();
        }
    }

    @Test
    @DisplayName("role changes are persisted")
    void updateRole() {
        repository.insert(Membership.active(businessY, user, Role.STAFF, NOW));

        assertThat(repository.updateRole(businessY, user, Role.ADMIN)).get()
                .extracting(Membership::role).isEqualTo(Role.ADMIN);
    }
}
