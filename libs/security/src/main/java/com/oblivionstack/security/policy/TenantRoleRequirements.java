package com.oblivionstack.security.policy;

import com.oblivionstack.security.Role;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Minimum roles, per operation, that a tenant-scoped policy demands on top of active membership
 * in the row's business. Operations without an entry only require membership.
 * <p>
 * The role sets are matched exactly; list every role that should pass.
 */
public final class TenantRoleRequirements {

    private static final TenantRoleRequirements DEFAULTS = new TenantRoleRequirements(Map.of(
            Operation.INSERT, EnumSet.of(Role.OWNER, Role.ADMIN, Role.MANAGER),
            Operation.UPDATE, EnumSet.of(Role.OWNER, Role.ADMIN, Role.MANAGER),
            Operation.DELETE, EnumSet.of(Role.OWNER, Role.ADMIN)));

    private final Map<Operation, Set<Role>> rolesByOperation;

    private TenantRoleRequirements(Map<Operation, Set<Role>> rolesByOperation) {
        Map<Operation, Set<Role>> copy = new EnumMap<>(Operation.class);
        rolesByOperation.forEach((operation, roles) -> {
            if (roles == null || roles.isEmpty()) {
                throw new IllegalArgumentException("Role set for " + operation.value() + " must not be empty");
            }
            copy.put(operation, Collections.unmodifiableSet(EnumSet.copyOf(roles)));
        });
        this.rolesByOperation = Collections.unmodifiableMap(copy);
    }

    /** Insert/update: owner, admin, manager. Delete: owner, admin. Select: membership only. */
    public static TenantRoleRequirements defaults() {
        return DEFAULTS;
    }

    /** Membership alone for every operation. */
    public static TenantRoleRequirements membershipOnly() {
        return new TenantRoleRequirements(Map.of());
    }

    public static TenantRoleRequirements of(Map<Operation, Set<Role>> rolesByOperation) {
        return new TenantRoleRequirements(rolesByOperation);
    }

    /** Returns a copy with {@code operation} requiring one of {@code roles}. */
    public TenantRoleRequirements with(Operation operation, Set<Role> roles) {
        Map<Operation, Set<Role>> copy = new EnumMap<>(Operation.class);
        copy.putAll(rolesByOperation);
        copy.put(operation, roles);
        return new TenantRoleRequirements(copy);
    }

    /** The roles required for {@code operation}, or empty if membership suffices. */
    public Optional<Set<Role>> rolesFor(Operation operation) {
        return Optional.ofNullable(rolesByOperation.get(operation));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TenantRoleRequirements other && rolesByOperation.equals(other.rolesByOperation);
    }

    @Override
    public int hashCode() {
        return rolesByOperation.hashCode();
    }

    @Override
    public String toString() {
        return "TenantRoleRequirements" + rolesByOperation;
    }
}
