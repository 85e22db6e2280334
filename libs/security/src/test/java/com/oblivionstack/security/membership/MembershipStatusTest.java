package com.oblivionstack.security.membership;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MembershipStatus")
class MembershipStatusTest {

    @Test
    @DisplayName("only active confers access")
    void confersAccess() {
        assertThat(MembershipStatus.ACTIVE.confersAccess()).isTrue();
        assertThat(MembershipStatus.PENDING.confersAccess()).isFalse();
        assertThat(MembershipStatus.INACTIVE.confersAccess()).isFalse();
    }

    @Test
    @DisplayName("allows the invitation and reinstatement transitions only")
    void transitions() {
        assertThat(MembershipStatus.PENDING.canTransitionTo(MembershipStatus.ACTIVE)).isTrue();
        assertThat(MembershipStatus.PENDING.canTransitionTo(MembershipStatus.INACTIVE)).isTrue();
        assertThat(MembershipStatus.ACTIVE.canTransitionTo(MembershipStatus.INACTIVE)).isTrue();
        assertThat(MembershipStatus.INACTIVE.canTransitionTo(MembershipStatus.ACTIVE)).isTrue();

        assertThat(MembershipStatus.ACTIVE.canTransitionTo(MembershipStatus.PENDING)).isFalse();
        assertThat(MembershipStatus.INACTIVE.canTransitionTo(MembershipStatus.PENDING)).isFalse();
        assertThat(MembershipStatus.ACTIVE.canTransitionTo(MembershipStatus.ACTIVE)).isFalse();
    }

    @Test
    @DisplayName("fromString() parses stored values")
    void fromString() {
        assertThat(MembershipStatus.fromString("pending")).contains(MembershipStatus.PENDING);
        assertThat(MembershipStatus.fromString("removed")).isEmpty();
    }
}
