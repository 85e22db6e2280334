package com.oblivionstack.security.policy;

import com.oblivionstack.observability.MetricFactory;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.membership.MembershipResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Authorizer} that evaluates the permissive rules held by a {@link PolicyRegistry}.
 * <p>
 * A row is accessible when at least one rule governing the operation holds. A resource that is
 * not enforced, or enforced without a rule for the operation, denies. A predicate that throws
 * counts as not holding.
 */
public class PolicyAuthorizer implements Authorizer {

    private static final Logger log = LoggerFactory.getLogger(PolicyAuthorizer.class);

    static final String METRIC_DECISIONS = "authz.decisions";

    private final PolicyRegistry registry;
    private final MembershipResolver membershipResolver;
    private final MetricFactory metrics;

    public PolicyAuthorizer(PolicyRegistry registry, MembershipResolver membershipResolver, MetricFactory metrics) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (membershipResolver == null) {
            throw new IllegalArgumentException("membershipResolver must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.registry = registry;
        this.membershipResolver = membershipResolver;
        this.metrics = metrics;
    }

    @Override
    public AccessDecision authorize(RequestContext context, ProtectedResource resource, ResourceRow row, Operation operation) {
        return authorize(newEvaluation(context), resource, row, operation);
    }

    /**
     * Starts an evaluation scope. Reuse the returned context for every row of one statement so
     * that identity and memberships are resolved once.
     */
    public EvaluationContext newEvaluation(RequestContext context) {
        return new EvaluationContext(context, membershipResolver);
    }

    public AccessDecision authorize(EvaluationContext evaluation, ProtectedResource resource, ResourceRow row, Operation operation) {
        AccessDecision decision = evaluate(evaluation, resource, row, operation);
        record(evaluation, resource, operation, decision);
        return decision;
    }

    /**
     * Authorizes an update: the caller must be allowed to update the row as it is and the row as
     * it will be, so a row cannot be moved into a tenant the caller does not control.
     */
    public AccessDecision authorizeUpdate(RequestContext context, ProtectedResource resource,
                                          ResourceRow existing, ResourceRow proposed) {
        return authorizeUpdate(newEvaluation(context), resource, existing, proposed);
    }

    public AccessDecision authorizeUpdate(EvaluationContext evaluation, ProtectedResource resource,
                                          ResourceRow existing, ResourceRow proposed) {
        AccessDecision decision = evaluate(evaluation, resource, existing, Operation.UPDATE);
        if (decision.allowed()) {
            decision = evaluate(evaluation, resource, proposed, Operation.UPDATE);
        }
        record(evaluation, resource, Operation.UPDATE, decision);
        return decision;
    }

    public PolicyRegistry registry() {
        return registry;
    }

    private AccessDecision evaluate(EvaluationContext evaluation, ProtectedResource resource, ResourceRow row, Operation operation) {
        if (resource == null || operation == null || row == null || !registry.isEnforced(resource)) {
            return AccessDecision.deny(AccessDecision.REASON_NOT_ENFORCED);
        }
        for (PolicyRule rule : registry.rulesFor(resource)) {
            if (rule.appliesTo(operation) && holds(rule, evaluation, row, resource)) {
                return AccessDecision.allow(rule.name());
            }
        }
        return AccessDecision.deny(AccessDecision.REASON_NO_MATCH);
    }

    private boolean holds(PolicyRule rule, EvaluationContext evaluation, ResourceRow row, ProtectedResource resource) {
        try {
            return rule.predicate().test(evaluation, row);
        } catch (RuntimeException e) {
            log.warn("Policy \"{}\" on {} failed to evaluate, treating as not permitted", rule.name(), resource, e);
            return false;
        }
    }

    private void record(EvaluationContext evaluation, ProtectedResource resource, Operation operation, AccessDecision decision) {
        String outcome = decision.allowed() ? "allow" : "deny";
        metrics.counter(METRIC_DECISIONS, "Authorization decisions",
                "resource", resource == null ? "unknown" : resource.qualifiedName(),
                "operation", operation == null ? "unknown" : operation.value(),
                "outcome", outcome).increment();
        if (log.isDebugEnabled()) {
            log.debug("{} {} on {} for user {}: {}", outcome, operation == null ? null : operation.value(),
                    resource, evaluation.userId(), decision.allowed() ? decision.policyName() : decision.reason());
        }
    }
}
