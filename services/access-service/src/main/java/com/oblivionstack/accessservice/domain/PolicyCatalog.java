package com.oblivionstack.accessservice.domain;

import com.oblivionstack.security.Role;
import com.oblivionstack.security.policy.Operation;
import com.oblivionstack.security.policy.PolicyFlags;
import com.oblivionstack.security.policy.PolicyRegistry;
import com.oblivionstack.security.policy.PolicyRule;
import com.oblivionstack.security.policy.PolicyTemplates;
import com.oblivionstack.security.policy.ProtectedResource;
import com.oblivionstack.security.policy.ResourcePolicyDefinition;
import com.oblivionstack.security.policy.ScopingStrategy;
import com.oblivionstack.security.policy.TenantRoleRequirements;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Policies for the tenancy tables this service owns, plus installation of configured ones.
 *
 * <p>Built-in rules:
 *
 * <ul>
 *   <li>{@code businesses}: members read, owners update
 *   <li>{@code business_users}: members read, owners and admins manage
 *   <li>{@code audit_logs}: owners and admins read
 * </ul>
 *
 * The trusted service principal has full access to the first two.
 */
public final class PolicyCatalog {

    private static final Logger log = LoggerFactory.getLogger(PolicyCatalog.class);

    public static final ProtectedResource BUSINESSES = ProtectedResource.table("businesses");
    public static final ProtectedResource BUSINESS_USERS = ProtectedResource.table("business_users");
    public static final ProtectedResource AUDIT_LOGS = ProtectedResource.table("audit_logs");

    public static final String VIEW_BUSINESS = "Users can view businesses they belong to";
    public static final String UPDATE_BUSINESS = "Only owners can update business";
    public static final String VIEW_BUSINESS_USERS = "Users can view business users in their business";
    public static final String MANAGE_BUSINESS_USERS = "Admins can manage business users";
    public static final String VIEW_AUDIT_LOGS = "Only admins can view audit logs";

    private PolicyCatalog() {
        // utility class
    }

    public static List<ResourcePolicyDefinition> builtIn() {
        Set<Role> ownerOrAdmin = EnumSet.of(Role.OWNER, Role.ADMIN);
        return List.of(
                custom(BUSINESSES, true,
                        PolicyRule.of(VIEW_BUSINESS, Operation.SELECT, PolicyTemplates.memberOfRowBusiness()),
                        PolicyRule.of(UPDATE_BUSINESS, Operation.UPDATE,
                                PolicyTemplates.roleInRowBusiness(EnumSet.of(Role.OWNER)))),
                custom(BUSINESS_USERS, true,
                        PolicyRule.of(VIEW_BUSINESS_USERS, Operation.SELECT, PolicyTemplates.memberOfRowBusiness()),
                        new PolicyRule(MANAGE_BUSINESS_USERS, EnumSet.allOf(Operation.class),
                                PolicyTemplates.roleInRowBusiness(ownerOrAdmin))),
                custom(AUDIT_LOGS, false,
                        PolicyRule.of(VIEW_AUDIT_LOGS, Operation.SELECT, PolicyTemplates.roleInRowBusiness(ownerOrAdmin))));
    }

    /**
     * Applies the built-in definitions followed by {@code configured} ones.
     *
     * @throws com.oblivionstack.security.policy.DuplicatePolicyException if a configured
     *     resource repeats a policy name already installed, e.g. the same table listed twice
     */
    public static void install(PolicyRegistry registry, List<ResourcePolicyDefinition> configured) {
        List<ResourcePolicyDefinition> all = new ArrayList<>(builtIn());
        all.addAll(configured);
        for (ResourcePolicyDefinition definition : all) {
            registry.apply(definition);
        }
        log.info("Policy catalog installed: {} resources policed", registry.resources().size());
    }

    private static ResourcePolicyDefinition custom(ProtectedResource resource, boolean serviceBypass,
                                                   PolicyRule... rules) {
        return new ResourcePolicyDefinition(resource, ScopingStrategy.CUSTOM, PolicyFlags.all(),
                TenantRoleRequirements.defaults(), serviceBypass, List.of(rules));
    }
}
