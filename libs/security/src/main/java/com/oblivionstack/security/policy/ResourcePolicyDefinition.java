package com.oblivionstack.security.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the declarative policy table: a resource, how its rows are scoped, which
 * operations get template rules, and whether the trusted service bypasses it.
 *
 * @param resource       the protected resource
 * @param strategy       scoping strategy
 * @param flags          operations to emit template rules for (ignored for PUBLIC_READ and CUSTOM)
 * @param roles          per-operation role minimums for TENANT scoping
 * @param serviceBypass  whether to add the trusted-service bypass rule
 * @param extraRules     further explicit rules, e.g. writes on a public-read table
 * @param readCondition  row condition for PUBLIC_READ selects; null reads unconditionally
 */
public record ResourcePolicyDefinition(
        ProtectedResource resource,
        ScopingStrategy strategy,
        PolicyFlags flags,
        TenantRoleRequirements roles,
        boolean serviceBypass,
        List<PolicyRule> extraRules,
        RowPredicate readCondition
) {

    public ResourcePolicyDefinition {
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        flags = flags == null ? PolicyFlags.all() : flags;
        roles = roles == null ? TenantRoleRequirements.defaults() : roles;
        extraRules = extraRules == null ? List.of() : List.copyOf(extraRules);
    }

    public ResourcePolicyDefinition(ProtectedResource resource, ScopingStrategy strategy, PolicyFlags flags,
                                    TenantRoleRequirements roles, boolean serviceBypass, List<PolicyRule> extraRules) {
        this(resource, strategy, flags, roles, serviceBypass, extraRules, null);
    }

    public static ResourcePolicyDefinition tenant(ProtectedResource resource) {
        return new ResourcePolicyDefinition(resource, ScopingStrategy.TENANT, PolicyFlags.all(),
                TenantRoleRequirements.defaults(), false, List.of());
    }

    public static ResourcePolicyDefinition owner(ProtectedResource resource) {
        return new ResourcePolicyDefinition(resource, ScopingStrategy.OWNER, PolicyFlags.all(),
                TenantRoleRequirements.defaults(), false, List.of());
    }

    /** A public-read resource whose selects are allowed where {@code condition} holds. */
    public static ResourcePolicyDefinition publicRead(ProtectedResource resource, RowPredicate condition) {
        return new ResourcePolicyDefinition(resource, ScopingStrategy.PUBLIC_READ, PolicyFlags.readOnly(),
                TenantRoleRequirements.defaults(), false, List.of(), condition);
    }

    public ResourcePolicyDefinition withServiceBypass() {
        return new ResourcePolicyDefinition(resource, strategy, flags, roles, true, extraRules, readCondition);
    }

    /** Expands the definition into the rules it stands for. */
    public List<PolicyRule> rules() {
        String table = resource.table();
        List<PolicyRule> templated = switch (strategy) {
            case TENANT -> PolicyTemplates.tenantScoped(table, flags, roles);
            case OWNER -> PolicyTemplates.ownerScoped(table, flags);
            case PUBLIC_READ -> List.of(PolicyTemplates.publicRead(table, readCondition));
            case CUSTOM -> List.of();
        };
        List<PolicyRule> rules = new ArrayList<>(templated);
        rules.addAll(extraRules);
        if (serviceBypass) {
            rules.add(PolicyTemplates.serviceBypass(table));
        }
        return rules;
    }
}
