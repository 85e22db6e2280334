package com.oblivionstack.security;

import com.oblivionstack.security.testing.TestRequestContextFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdentityResolver")
class IdentityResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final IdentityResolver resolver =
            new IdentityResolver(Clock.fixed(NOW, ZoneOffset.UTC), IdentityResolver.DEFAULT_TRUSTED_SERVICE_PRINCIPAL);

    @Nested
    @DisplayName("currentUserId()")
    class CurrentUserId {

        @Test
        @DisplayName("returns the subject of valid claims")
        void validSubject() {
            UserId user = UserId.random();
            assertThat(resolver.currentUserId(TestRequestContextFactory.forUser(user))).isEqualTo(user);
        }

        @Test
        @DisplayName("returns the nil sentinel without claims")
        void anonymous() {
            assertThat(resolver.currentUserId(RequestContext.anonymous())).isEqualTo(UserId.NIL);
            assertThat(resolver.currentUserId(null)).isEqualTo(UserId.NIL);
            assertThat(UserId.NIL.toString()).isEqualTo("00000000-0000-0000-0000-000000000000");
        }

        @Test
        @DisplayName("returns the nil sentinel for a non-UUID or blank subject")
        void malformedSubject() {
            assertThat(resolver.currentUserId(TestRequestContextFactory.withSubject("not-a-uuid"))).isEqualTo(UserId.NIL);
            assertThat(resolver.currentUserId(TestRequestContextFactory.withSubject(" "))).isEqualTo(UserId.NIL);
        }

        @Test
        @DisplayName("returns the nil sentinel once the claims have expired")
        void expired() {
            UserId user = UserId.random();
            assertThat(resolver.currentUserId(TestRequestContextFactory.expired(user, NOW))).isEqualTo(UserId.NIL);
            assertThat(resolver.currentUserId(TestRequestContextFactory.expired(user, NOW.plusSeconds(60)))).isEqualTo(user);
        }

        @Test
        @DisplayName("is stable across repeated calls")
        void stable() {
            RequestContext context = TestRequestContextFactory.create();
            assertThat(resolver.currentUserId(context)).isEqualTo(resolver.currentUserId(context));
        }
    }

    @Nested
    @DisplayName("isTrustedService()")
    class TrustedService {

        @Test
        @DisplayName("recognises the configured service principal")
        void recognised() {
            assertThat(resolver.isTrustedService(TestRequestContextFactory.trustedService())).isTrue();
            assertThat(resolver.isTrustedService(TestRequestContextFactory.create())).isFalse();
            assertThat(resolver.isTrustedService(RequestContext.anonymous())).isFalse();
        }

        @Test
        @DisplayName("is not an end-user identity")
        void notAUser() {
            assertThat(resolver.isAuthenticated(TestRequestContextFactory.trustedService())).isFalse();
        }

        @Test
        @DisplayName("rejects a blank principal name")
        void blankPrincipal() {
            assertThatThrownBy(() -> new IdentityResolver(Clock.systemUTC(), " "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
