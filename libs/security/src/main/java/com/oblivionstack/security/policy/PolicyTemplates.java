package com.oblivionstack.security.policy;

import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical rule shapes. Rule names derive from the table name alone, so applying the same
 * template twice to one resource collides on names.
 */
public final class PolicyTemplates {

    public static final String TENANT_SELECT = "Users can view own business %s";
    public static final String TENANT_INSERT = "Users can insert into own business %s";
    public static final String TENANT_UPDATE = "Users can update own business %s";
    public static final String TENANT_DELETE = "Users can delete from own business %s";

    public static final String OWNER_SELECT = "Users can view own %s";
    public static final String OWNER_INSERT = "Users can insert own %s";
    public static final String OWNER_UPDATE = "Users can update own %s";
    public static final String OWNER_DELETE = "Users can delete own %s";

    public static final String PUBLIC_READ = "Public can read %s";
    public static final String SERVICE_BYPASS = "Service role has full access to %s";

    private PolicyTemplates() {
        // utility class
    }

    /**
     * Rows are reachable by active members of the row's business. Operations with a role
     * requirement additionally need the caller's role there to be in the required set.
     */
    public static List<PolicyRule> tenantScoped(String table, PolicyFlags flags, TenantRoleRequirements requirements) {
        List<PolicyRule> rules = new ArrayList<>(4);
        addIfEnabled(rules, flags, Operation.SELECT, TENANT_SELECT.formatted(table), tenantPredicate(requirements, Operation.SELECT));
        addIfEnabled(rules, flags, Operation.INSERT, TENANT_INSERT.formatted(table), tenantPredicate(requirements, Operation.INSERT));
        addIfEnabled(rules, flags, Operation.UPDATE, TENANT_UPDATE.formatted(table), tenantPredicate(requirements, Operation.UPDATE));
        addIfEnabled(rules, flags, Operation.DELETE, TENANT_DELETE.formatted(table), tenantPredicate(requirements, Operation.DELETE));
        return rules;
    }

    public static List<PolicyRule> tenantScoped(String table, PolicyFlags flags) {
        return tenantScoped(table, flags, TenantRoleRequirements.defaults());
    }

    /** Rows are reachable only by the user they belong to, for every enabled operation. */
    public static List<PolicyRule> ownerScoped(String table, PolicyFlags flags) {
        List<PolicyRule> rules = new ArrayList<>(4);
        addIfEnabled(rules, flags, Operation.SELECT, OWNER_SELECT.formatted(table), ownerPredicate());
        addIfEnabled(rules, flags, Operation.INSERT, OWNER_INSERT.formatted(table), ownerPredicate());
        addIfEnabled(rules, flags, Operation.UPDATE, OWNER_UPDATE.formatted(table), ownerPredicate());
        addIfEnabled(rules, flags, Operation.DELETE, OWNER_DELETE.formatted(table), ownerPredicate());
        return rules;
    }

    /**
     * Select for everyone under {@code condition}, unconditional when null. No write rule is
     * emitted.
     */
    public static PolicyRule publicRead(String table, RowPredicate condition) {
        return PolicyRule.of(PUBLIC_READ.formatted(table), Operation.SELECT,
                condition == null ? RowPredicate.always() : condition);
    }

    /** Every operation for the trusted service principal, regardless of row content. */
    public static PolicyRule serviceBypass(String table) {
        return new PolicyRule(SERVICE_BYPASS.formatted(table), EnumSet.allOf(Operation.class),
                (context, row) -> context.isTrustedService());
    }

    /** Active member of the row's business. */
    public static RowPredicate memberOfRowBusiness() {
        return (context, row) -> context.belongsTo(row.businessId());
    }

    /** Active member of the row's business holding exactly one of {@code roles}. */
    public static RowPredicate roleInRowBusiness(Set<Role> roles) {
        Set<Role> allowed = Set.copyOf(roles);
        return (context, row) -> context.roleIn(row.businessId()).map(allowed::contains).orElse(false);
    }

    /** The row belongs to the caller. Never true for the nil identity. */
    public static RowPredicate ownedByCaller() {
        return ownerPredicate();
    }

    private static RowPredicate tenantPredicate(TenantRoleRequirements requirements, Operation operation) {
        return requirements.rolesFor(operation)
                .map(PolicyTemplates::roleInRowBusiness)
                .orElseGet(PolicyTemplates::memberOfRowBusiness);
    }

    private static RowPredicate ownerPredicate() {
        return (context, row) -> {
            UserId caller = context.userId();
            return !caller.isNil() && caller.equals(row.ownerId());
        };
    }

    private static void addIfEnabled(List<PolicyRule> rules, PolicyFlags flags, Operation operation,
                                     String name, RowPredicate predicate) {
        if (flags.enabled(operation)) {
            rules.add(PolicyRule.of(name, operation, predicate));
        }
    }
}
