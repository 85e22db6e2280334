package com.oblivionstack.security.membership;

/**
 * Thrown when a membership status change is not one of the allowed lifecycle transitions.
 */
public class InvalidMembershipTransitionException extends RuntimeException {

    private final MembershipStatus from;
    private final MembershipStatus to;

    public InvalidMembershipTransitionException(MembershipStatus from, MembershipStatus to) {
        super("Membership cannot move from '%s' to '%s'".formatted(from.value(), to.value()));
        this.from = from;
        this.to = to;
    }

    public MembershipStatus from() {
        return from;
    }

    public MembershipStatus to() {
        return to;
    }
}
