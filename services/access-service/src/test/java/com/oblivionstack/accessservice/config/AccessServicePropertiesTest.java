package com.oblivionstack.accessservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.oblivionstack.accessservice.config.AccessServiceProperties.MembershipView;
import com.oblivionstack.accessservice.config.AccessServiceProperties.ResourceEntry;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.policy.Operation;
import com.oblivionstack.security.policy.PolicyFlags;
import com.oblivionstack.security.policy.ProtectedResource;
import com.oblivionstack.security.policy.ResourcePolicyDefinition;
import com.oblivionstack.security.policy.ScopingStrategy;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AccessServiceProperties")
class AccessServicePropertiesTest {

    @Test
    @DisplayName("defaults the trusted principal, refresh settings and resources")
    void defaults() {
        AccessServiceProperties properties = new AccessServiceProperties(null, null, null);

        assertThat(properties.trustedServicePrincipal()).isEqualTo("service_role");
        assertThat(properties.membershipView().refreshInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.membershipView().refreshOnStartup()).isTrue();
        assertThat(properties.resources()).isEmpty();
    }

    @Test
    @DisplayName("a non-positive refresh interval falls back to the default")
    void refreshInterval() {
        assertThat(new MembershipView(Duration.ZERO, false).refreshInterval())
                .isEqualTo(MembershipView.DEFAULT_REFRESH_INTERVAL);
    }

    @Nested
    @DisplayName("resource entries")
    class ResourceEntries {

        @Test
        @DisplayName("default to a tenant policy on the public schema for every operation")
        void tenantDefaults() {
            ResourcePolicyDefinition definition =
                    new ResourceEntry(null, "appointments", null, null, null, false).toDefinition();

            assertThat(definition.resource()).isEqualTo(ProtectedResource.table("appointments"));
            assertThat(definition.strategy()).isEqualTo(ScopingStrategy.TENANT);
            assertThat(definition.flags()).isEqualTo(PolicyFlags.all());
            assertThat(definition.serviceBypass()).isFalse();
        }

        @Test
        @DisplayName("map operations, roles and the service bypass")
        void explicit() {
            ResourceEntry entry = new ResourceEntry("crm", "leads", "tenant", Set.of("select", "delete"),
                    Map.of("delete", Set.of("owner")), true);

            ResourcePolicyDefinition definition = entry.toDefinition();

            assertThat(definition.flags().operations()).containsExactlyInAnyOrder(Operation.SELECT, Operation.DELETE);
            assertThat(definition.roles().rolesFor(Operation.DELETE)).contains(Set.of(Role.OWNER));
            assertThat(definition.serviceBypass()).isTrue();
            assertThat(definition.resource().qualifiedName()).isEqualTo("crm.leads");
        }

        @Test
        @DisplayName("accept hyphenated strategy names")
        void publicRead() {
            assertThat(new ResourceEntry(null, "industries", "public-read", null, null, false)
                    .toDefinition().strategy()).isEqualTo(ScopingStrategy.PUBLIC_READ);
        }

        @Test
        @DisplayName("reject unknown strategies, operations, roles and the custom strategy")
        void invalid() {
            assertThatThrownBy(() -> new ResourceEntry(null, "t", "global", null, null, false).toDefinition())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ResourceEntry(null, "t", "tenant", Set.of("upsert"), null, false)
                    .toDefinition()).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ResourceEntry(null, "t", "tenant", null,
                    Map.of("update", Set.of("superuser")), false).toDefinition())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ResourceEntry(null, "t", "custom", null, null, false).toDefinition())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
