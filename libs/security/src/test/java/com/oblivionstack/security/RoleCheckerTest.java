package com.oblivionstack.security;

import com.oblivionstack.security.membership.InMemoryMembershipRepository;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.membership.MembershipStatus;
import com.oblivionstack.security.testing.TestRequestContextFactory;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    private final BusinessId businessX = BusinessId.random();
    private final BusinessId businessY = BusinessId.random();
    private InMemoryMembershipRepository repository;
    private RoleChecker checker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMembershipRepository();
        checker = new RoleChecker(new MembershipResolver(repository, new IdentityResolver()));
    }

    private RequestContext member(BusinessId business, Role role) {
        UserId user = UserId.random();
        repository.insert(Membership.active(business, user, role, Instant.now()));
        return TestRequestContextFactory.forUser(user);
    }

    @Nested
    @DisplayName("hasRole()")
    class HasRole {

        @Test
        @DisplayName("staff passes staff but not manager or admin")
        void staff() {
            RequestContext staff = member(businessX, Role.STAFF);
            assertThat(checker.hasRole(staff, Role.STAFF)).isTrue();
            assertThat(checker.hasRole(staff, Role.MANAGER)).isFalse();
            assertThat(checker.hasRole(staff, Role.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("admin passes manager and staff but not owner")
        void admin() {
            RequestContext admin = member(businessX, Role.ADMIN);
            assertThat(checker.hasRole(admin, Role.MANAGER)).isTrue();
            assertThat(checker.hasRole(admin, Role.STAFF)).isTrue();
            assertThat(checker.hasRole(admin, Role.OWNER)).isFalse();
        }

        @Test
        @DisplayName("owner passes every requirement")
        void owner() {
            RequestContext owner = member(businessX, Role.OWNER);
            for (Role required : Role.values()) {
                assertThat(checker.hasRole(owner, required)).isTrue();
            }
        }

        @Test
        @DisplayName("client never passes a staff requirement")
        void client() {
            RequestContext client = member(businessX, Role.CLIENT);
            assertThat(checker.hasRole(client, Role.STAFF)).isFalse();
            assertThat(checker.hasAnyRole(client, Role.STAFF, Role.MANAGER)).isFalse();
        }

        @Test
        @DisplayName("inactive memberships confer nothing")
        void inactive() {
            UserId user = UserId.random();
            repository.insert(Membership.active(businessX, user, Role.OWNER, Instant.now()));
            repository.updateStatus(businessX, user, MembershipStatus.ACTIVE, MembershipStatus.INACTIVE);

            assertThat(checker.hasRole(TestRequestContextFactory.forUser(user), Role.STAFF)).isFalse();
        }

        @Test
        @DisplayName("anonymous callers hold no role")
        void anonymous() {
            assertThat(checker.hasRole(RequestContext.anonymous(), Role.CLIENT)).isFalse();
        }
    }

    @Test
    @DisplayName("hasRoleIn() only considers the named business")
    void hasRoleIn() {
        UserId user = UserId.random();
        repository.insert(Membership.active(businessX, user, Role.OWNER, Instant.now()));
        repository.insert(Membership.active(businessY, user, Role.STAFF, Instant.now()));
        RequestContext context = TestRequestContextFactory.forUser(user);

        assertThat(checker.hasRoleIn(context, businessX, Role.ADMIN)).isTrue();
        assertThat(checker.hasRoleIn(context, businessY, Role.ADMIN)).isFalse();
        assertThat(checker.hasRoleIn(context, BusinessId.random(), Role.STAFF)).isFalse();
    }
}
