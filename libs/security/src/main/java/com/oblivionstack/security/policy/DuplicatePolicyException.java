package com.oblivionstack.security.policy;

/**
 * Thrown when a policy is added to a resource that already has a policy of the same name.
 * Drop the resource's policies before re-applying a template.
 */
public class DuplicatePolicyException extends RuntimeException {

    private final ProtectedResource resource;
    private final String policyName;

    public DuplicatePolicyException(ProtectedResource resource, String policyName) {
        super("Policy \"%s\" for table \"%s\" already exists".formatted(policyName, resource.qualifiedName()));
        this.resource = resource;
        this.policyName = policyName;
    }

    public ProtectedResource resource() {
        return resource;
    }

    public String policyName() {
        return policyName;
    }
}
