package com.oblivionstack.security.policy;

/**
 * Result of an authorization check.
 *
 * @param allowed    whether access is granted
 * @param policyName the first rule that permitted access, null on deny
 * @param reason     short machine-friendly explanation, for logs only
 */
public record AccessDecision(boolean allowed, String policyName, String reason) {

    public static final String REASON_NOT_ENFORCED = "no_policies";
    public static final String REASON_NO_MATCH = "no_permitting_policy";

    public static AccessDecision allow(String policyName) {
        return new AccessDecision(true, policyName, "permitted");
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, null, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
