package com.oblivionstack.security.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Permissive rule sets per protected resource.
 * <p>
 * A resource becomes enforced the first time any rule set is applied to it, even an empty one,
 * and stays enforced until {@link #drop}ped. Applying a rule whose name already exists on the
 * resource fails with {@link DuplicatePolicyException} and leaves the resource unchanged.
 * <p>
 * Thread-safe. Readers get immutable rule lists.
 */
public class PolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final ConcurrentMap<ProtectedResource, List<PolicyRule>> rules = new ConcurrentHashMap<>();

    /**
     * Adds {@code newRules} to {@code resource} atomically.
     *
     * @throws DuplicatePolicyException if any name is already present or repeated in the batch
     */
    public void apply(ProtectedResource resource, Collection<PolicyRule> newRules) {
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        List<PolicyRule> batch = List.copyOf(newRules);
        rules.compute(resource, (key, existing) -> {
            List<PolicyRule> merged = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            Set<String> names = new HashSet<>();
            merged.forEach(rule -> names.add(rule.name()));
            for (PolicyRule rule : batch) {
                if (!names.add(rule.name())) {
                    throw new DuplicatePolicyException(resource, rule.name());
                }
                merged.add(rule);
            }
            return List.copyOf(merged);
        });
        log.info("Applied {} policies to {}", batch.size(), resource);
    }

    public void apply(ProtectedResource resource, PolicyRule rule) {
        apply(resource, List.of(rule));
    }

    /** Applies every rule a declarative definition expands to. */
    public void apply(ResourcePolicyDefinition definition) {
        apply(definition.resource(), definition.rules());
    }

    public void applyTenantPolicies(String schema, String table, PolicyFlags flags) {
        applyTenantPolicies(ProtectedResource.of(schema, table), flags, TenantRoleRequirements.defaults());
    }

    public void applyTenantPolicies(ProtectedResource resource, PolicyFlags flags, TenantRoleRequirements roles) {
        apply(resource, PolicyTemplates.tenantScoped(resource.table(), flags, roles));
    }

    public void applyOwnerPolicies(String schema, String table, PolicyFlags flags) {
        ProtectedResource resource = ProtectedResource.of(schema, table);
        apply(resource, PolicyTemplates.ownerScoped(resource.table(), flags));
    }

    /** Applies an unconditional public select rule. */
    public void applyPublicReadPolicy(String schema, String table) {
        applyPublicReadPolicy(schema, table, null);
    }

    public void applyPublicReadPolicy(String schema, String table, RowPredicate condition) {
        ProtectedResource resource = ProtectedResource.of(schema, table);
        apply(resource, PolicyTemplates.publicRead(resource.table(), condition));
    }

    public void applyServiceBypass(String schema, String table) {
        ProtectedResource resource = ProtectedResource.of(schema, table);
        apply(resource, PolicyTemplates.serviceBypass(resource.table()));
    }

    /**
     * Removes every rule of {@code resource} and stops enforcing it.
     *
     * @return number of rules removed
     */
    public int drop(ProtectedResource resource) {
        List<PolicyRule> removed = rules.remove(resource);
        if (removed == null) {
            return 0;
        }
        log.info("Dropped {} policies from {}", removed.size(), resource);
        return removed.size();
    }

    /**
     * Removes a single named rule. The resource stays enforced even when no rule is left.
     *
     * @return true if the rule existed
     */
    public boolean dropPolicy(ProtectedResource resource, String policyName) {
        boolean[] removed = {false};
        rules.computeIfPresent(resource, (key, existing) -> {
            List<PolicyRule> kept = existing.stream().filter(rule -> !rule.name().equals(policyName)).toList();
            removed[0] = kept.size() != existing.size();
            return kept;
        });
        return removed[0];
    }

    public boolean isEnforced(ProtectedResource resource) {
        return rules.containsKey(resource);
    }

    /** The rules of {@code resource}, empty when it has none or is not enforced. */
    public List<PolicyRule> rulesFor(ProtectedResource resource) {
        return rules.getOrDefault(resource, List.of());
    }

    public List<String> policyNames(ProtectedResource resource) {
        return rulesFor(resource).stream().map(PolicyRule::name).toList();
    }

    public Set<ProtectedResource> resources() {
        return Set.copyOf(rules.keySet());
    }
}
