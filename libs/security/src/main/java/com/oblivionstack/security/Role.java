package com.oblivionstack.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Roles a user can hold within one business.
 * <p>
 * The role belongs to the membership, not the user: the same user may be {@code owner} of one
 * business and {@code staff} in another. Dominance is an explicit allow-list of
 * (actual, required) pairs rather than an ordinal comparison:
 * <ul>
 *   <li>OWNER satisfies every requirement</li>
 *   <li>ADMIN satisfies ADMIN, MANAGER and STAFF, never OWNER</li>
 *   <li>MANAGER satisfies MANAGER and STAFF</li>
 *   <li>STAFF and CLIENT satisfy only themselves</li>
 * </ul>
 * CLIENT sits outside the staff hierarchy; clients reach their own rows through ownership
 * policies, not through role dominance.
 */
public enum Role {

    OWNER("owner"),
    ADMIN("admin"),
    MANAGER("manager"),
    STAFF("staff"),
    CLIENT("client");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation, as stored in {@code business_users.role}. */
    public String value() {
        return value;
    }

    /**
     * Checks whether a member holding this role passes a check for {@code required}.
     */
    public boolean satisfies(Role required) {
        if (required == null) {
            return false;
        }
        if (this == required) {
            return true;
        }
        return switch (this) {
            case OWNER -> true;
            case ADMIN -> required == MANAGER || required == STAFF;
            case MANAGER -> required == STAFF;
            default -> false;
        };
    }

    /**
     * Returns every role that satisfies this role as a requirement. Used to turn a hierarchical
     * check into an exact-match role set for membership queries.
     */
    public Set<Role> satisfiedBy() {
        Set<Role> result = EnumSet.noneOf(Role.class);
        for (Role candidate : values()) {
            if (candidate.satisfies(this)) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * Looks up a Role by its canonical string value (e.g. "manager"), ignoring case.
     *
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip();
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known role. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
