package com.oblivionstack.accessservice.config;

import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.policy.Operation;
import com.oblivionstack.security.policy.PolicyFlags;
import com.oblivionstack.security.policy.ProtectedResource;
import com.oblivionstack.security.policy.ResourcePolicyDefinition;
import com.oblivionstack.security.policy.ScopingStrategy;
import com.oblivionstack.security.policy.TenantRoleRequirements;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from {@code oblivion.access.*}.
 *
 * <pre>
 * oblivion:
 *   access:
 *     trusted-service-principal: service_role
 *     membership-view:
 *       refresh-interval: PT5M
 *       refresh-on-startup: true
 *     resources:
 *       - table: appointments
 *         strategy: tenant
 *         service-bypass: true
 *       - table: user_preferences
 *         strategy: owner
 *         operations: [select, update]
 *       - table: industries
 *         strategy: public-read
 * </pre>
 *
 * @param trustedServicePrincipal principal-role claim that bypasses tenant scoping where allowed
 * @param membershipView          cached membership view refresh settings
 * @param resources               tables policed from configuration, in addition to the built-in ones
 */
@ConfigurationProperties(prefix = "oblivion.access")
@Validated
public record AccessServiceProperties(
        String trustedServicePrincipal,
        @Valid MembershipView membershipView,
        @Valid List<ResourceEntry> resources) {

    public AccessServiceProperties {
        if (trustedServicePrincipal == null || trustedServicePrincipal.isBlank()) {
            trustedServicePrincipal = IdentityResolver.DEFAULT_TRUSTED_SERVICE_PRINCIPAL;
        }
        if (membershipView == null) {
            membershipView = new MembershipView(null, null);
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /**
     * @param refreshInterval  delay between refreshes of the cached view
     * @param refreshOnStartup whether to build the view once the application is ready
     */
    public record MembershipView(Duration refreshInterval, Boolean refreshOnStartup) {

        public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);

        public MembershipView {
            if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative()) {
                refreshInterval = DEFAULT_REFRESH_INTERVAL;
            }
            if (refreshOnStartup == null) {
                refreshOnStartup = Boolean.TRUE;
            }
        }
    }

    /**
     * One policed table.
     *
     * @param schema        schema name, {@code public} when absent
     * @param table         table name
     * @param strategy      {@code tenant}, {@code owner} or {@code public-read}
     * @param operations    operations the template emits rules for; all when empty
     * @param roles         tenant strategy only: roles required per operation, by operation name
     * @param serviceBypass add a full-access rule for the trusted service principal
     */
    public record ResourceEntry(
            String schema,
            @NotBlank String table,
            String strategy,
            Set<String> operations,
            Map<String, Set<String>> roles,
            boolean serviceBypass) {

        public ResourceEntry {
            if (schema == null || schema.isBlank()) {
                schema = ProtectedResource.DEFAULT_SCHEMA;
            }
            if (strategy == null || strategy.isBlank()) {
                strategy = ScopingStrategy.TENANT.value();
            }
            operations = operations == null ? Set.of() : Set.copyOf(operations);
            roles = roles == null ? Map.of() : Map.copyOf(roles);
        }

        /**
         * Converts the entry to a policy definition.
         *
         * @throws IllegalArgumentException for unknown strategies, operations or roles, or a
         *     {@code custom} strategy, which has no rules to take from configuration
         */
        public ResourcePolicyDefinition toDefinition() {
            ProtectedResource resource = ProtectedResource.of(schema, table);
            ScopingStrategy scoping = ScopingStrategy.fromString(strategy)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown scoping strategy '" + strategy + "' for " + resource));
            if (scoping == ScopingStrategy.CUSTOM) {
                throw new IllegalArgumentException("Custom policies cannot be configured for " + resource);
            }
            PolicyFlags flags = operations.isEmpty() ? PolicyFlags.all() : PolicyFlags.of(parseOperations(operations));
            TenantRoleRequirements requirements = TenantRoleRequirements.defaults();
            for (Map.Entry<String, Set<String>> entry : roles.entrySet()) {
                requirements = requirements.with(parseOperation(entry.getKey()), parseRoles(entry.getValue()));
            }
            return new ResourcePolicyDefinition(resource, scoping, flags, requirements, serviceBypass, List.of());
        }

        private static Set<Operation> parseOperations(Set<String> names) {
            Set<Operation> parsed = EnumSet.noneOf(Operation.class);
            names.forEach(name -> parsed.add(parseOperation(name)));
            return parsed;
        }

        private static Operation parseOperation(String name) {
            return Operation.fromString(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + name));
        }

        private static Set<Role> parseRoles(Set<String> names) {
            Set<Role> parsed = new LinkedHashSet<>();
            for (String name : names) {
                parsed.add(Role.fromString(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + name)));
            }
            return parsed;
        }
    }
}
