package com.oblivionstack.security;

/**
 * Rule table for cross-role management actions, e.g. a manager editing a staff member.
 *
 * <pre>
 * actor    permissions            target roles
 * owner    any                    any
 * admin    any but owner_only     any
 * manager  read, write            staff, client
 * staff    read                   any
 * client   none
 * </pre>
 */
public final class HierarchicalAccessRules {

    private HierarchicalAccessRules() {
        // utility class
    }

    /**
     * Decides whether {@code actor} may exercise {@code permission} over a member holding
     * {@code target}. Any null argument denies.
     */
    public static boolean permits(Role actor, Role target, Permission permission) {
        if (actor == null || target == null || permission == null) {
            return false;
        }
        return switch (actor) {
            case OWNER -> true;
            case ADMIN -> permission != Permission.OWNER_ONLY;
            case MANAGER -> (target == Role.STAFF || target == Role.CLIENT)
                    && (permission == Permission.READ || permission == Permission.WRITE);
            case STAFF -> permission == Permission.READ;
            case CLIENT -> false;
        };
    }
}
