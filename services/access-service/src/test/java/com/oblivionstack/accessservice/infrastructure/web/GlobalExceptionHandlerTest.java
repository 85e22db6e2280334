package com.oblivionstack.accessservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.oblivionstack.accessservice.domain.AuthenticationRequiredException;
import com.oblivionstack.accessservice.domain.NotFoundException;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.DuplicateMembershipException;
import com.oblivionstack.security.membership.InvalidMembershipTransitionException;
import com.oblivionstack.security.membership.MembershipStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void badRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps not-found-or-not-permitted to 404")
    void notFound() {
        ProblemDetail result = handler.handleNotFound(new NotFoundException("No business x"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getType().toString()).endsWith("/not-found");
    }

    @Test
    @DisplayName("maps a missing identity to 401")
    void unauthorized() {
        assertThat(handler.handleAuthenticationRequired(new AuthenticationRequiredException("who?")).getStatus())
                .isEqualTo(401);
    }

    @Test
    @DisplayName("maps duplicates and invalid transitions to 409")
    void conflicts() {
        assertThat(handler.handleConflict(new DuplicateMembershipException(BusinessId.random(), UserId.random()))
                .getStatus()).isEqualTo(409);
        assertThat(handler.handleConflict(
                new InvalidMembershipTransitionException(MembershipStatus.INACTIVE, MembershipStatus.INACTIVE))
                .getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("maps anything else to 500 without leaking the message")
    void internal() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("db password is hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("hunter2");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
