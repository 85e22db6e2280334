package com.oblivionstack.security;

import com.oblivionstack.security.membership.InMemoryMembershipRepository;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.testing.TestRequestContextFactory;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HierarchicalAccessEvaluator")
class HierarchicalAccessEvaluatorTest {

    private final InMemoryMembershipRepository repository = new InMemoryMembershipRepository();
    private final HierarchicalAccessEvaluator evaluator =
            new HierarchicalAccessEvaluator(new MembershipResolver(repository, new IdentityResolver()));

    @Test
    @DisplayName("uses the caller's role in their only business")
    void singleTenant() {
        UserId manager = UserId.random();
        repository.insert(Membership.active(BusinessId.random(), manager, Role.MANAGER, Instant.now()));
        RequestContext context = TestRequestContextFactory.forUser(manager);

        assertThat(evaluator.check(context, Role.STAFF, Permission.WRITE)).isTrue();
        assertThat(evaluator.check(context, Role.ADMIN, Permission.WRITE)).isFalse();
    }

    @Test
    @DisplayName("explicit business form checks the role held there")
    void explicitBusiness() {
        UserId user = UserId.random();
        BusinessId owned = BusinessId.random();
        BusinessId staffed = BusinessId.random();
        repository.insert(Membership.active(owned, user, Role.OWNER, Instant.now()));
        repository.insert(Membership.active(staffed, user, Role.STAFF, Instant.now()));
        RequestContext context = TestRequestContextFactory.forUser(user);

        assertThat(evaluator.check(context, owned, Role.ADMIN, Permission.OWNER_ONLY)).isTrue();
        assertThat(evaluator.check(context, staffed, Role.CLIENT, Permission.WRITE)).isFalse();
        assertThat(evaluator.check(context, staffed, Role.CLIENT, Permission.READ)).isTrue();
    }

    @Test
    @DisplayName("denies callers without any membership")
    void noMembership() {
        assertThat(evaluator.check(TestRequestContextFactory.create(), Role.CLIENT, Permission.READ)).isFalse();
        assertThat(evaluator.check(RequestContext.anonymous(), Role.CLIENT, Permission.READ)).isFalse();
    }
}
