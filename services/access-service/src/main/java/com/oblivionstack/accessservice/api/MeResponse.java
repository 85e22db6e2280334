package com.oblivionstack.accessservice.api;

import java.util.List;

/**
 * The caller as the authorization layer sees them.
 *
 * @param userId            resolved user, the nil UUID when anonymous
 * @param currentBusinessId one of the caller's active businesses, null when there is none
 * @param businesses        businesses the caller is an active member of, not deleted, most
 *                          recently joined first
 */
public record MeResponse(
        String userId,
        boolean authenticated,
        boolean trustedService,
        String currentBusinessId,
        List<UserBusinessResponse> businesses) {
}
