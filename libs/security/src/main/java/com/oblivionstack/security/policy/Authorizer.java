package com.oblivionstack.security.policy;

import com.oblivionstack.security.RequestContext;

/**
 * Single authorization entry point called by the data-access layer before or after a fetch.
 * <p>
 * Denial is the default: unknown resources, resources without rules and predicates that cannot
 * be evaluated all deny. A denied row must be treated as absent, not reported as forbidden.
 */
public interface Authorizer {

    AccessDecision authorize(RequestContext context, ProtectedResource resource, ResourceRow row, Operation operation);

    default boolean isAllowed(RequestContext context, ProtectedResource resource, ResourceRow row, Operation operation) {
        return authorize(context, resource, row, operation).allowed();
    }
}
