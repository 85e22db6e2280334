package com.oblivionstack.accessservice.api;

import com.oblivionstack.security.policy.AccessDecision;

public record DecisionResponse(String resource, String operation, boolean allowed, String policy, String reason) {

    static DecisionResponse of(String resource, String operation, AccessDecision decision) {
        return new DecisionResponse(resource, operation, decision.allowed(), decision.policyName(), decision.reason());
    }
}
