package com.oblivionstack.security.membership;

import java.util.Optional;

/**
 * Lifecycle status of a membership. Only {@link #ACTIVE} confers access.
 * <p>
 * Allowed transitions: {@code pending -> active} (invite accepted), {@code pending -> inactive}
 * (invite revoked), {@code active -> inactive} (member removed) and {@code inactive -> active}
 * (member reinstated).
 */
public enum MembershipStatus {

    ACTIVE("active"),
    INACTIVE("inactive"),
    PENDING("pending");

    private final String value;

    MembershipStatus(String value) {
        this.value = value;
    }

    /** The canonical string representation, as stored in {@code business_users.status}. */
    public String value() {
        return value;
    }

    public boolean confersAccess() {
        return this == ACTIVE;
    }

    /** Checks whether a membership in this status may move to {@code target}. */
    public boolean canTransitionTo(MembershipStatus target) {
        return switch (this) {
            case PENDING -> target == ACTIVE || target == INACTIVE;
            case ACTIVE -> target == INACTIVE;
            case INACTIVE -> target == ACTIVE;
        };
    }

    public static Optional<MembershipStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MembershipStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
