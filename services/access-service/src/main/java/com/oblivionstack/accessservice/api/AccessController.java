package com.oblivionstack.accessservice.api;

import com.oblivionstack.accessservice.domain.TenantProvisioningService;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.HierarchicalAccessEvaluator;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.Permission;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.RoleChecker;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.policy.AccessDecision;
import com.oblivionstack.security.policy.Operation;
import com.oblivionstack.security.policy.PolicyAuthorizer;
import com.oblivionstack.security.policy.ProtectedResource;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authorization questions about the caller: who they are, whether a row operation is permitted,
 * and what the role hierarchy allows them.
 */
@RestController
@RequestMapping("/api/v1/access")
public class AccessController {

    private final IdentityResolver identityResolver;
    private final MembershipResolver membershipResolver;
    private final RoleChecker roleChecker;
    private final HierarchicalAccessEvaluator hierarchy;
    private final PolicyAuthorizer authorizer;
    private final TenantProvisioningService provisioning;

    public AccessController(IdentityResolver identityResolver, MembershipResolver membershipResolver,
                            RoleChecker roleChecker, HierarchicalAccessEvaluator hierarchy,
                            PolicyAuthorizer authorizer, TenantProvisioningService provisioning) {
        this.identityResolver = identityResolver;
        this.membershipResolver = membershipResolver;
        this.roleChecker = roleChecker;
        this.hierarchy = hierarchy;
        this.authorizer = authorizer;
        this.provisioning = provisioning;
    }

    @GetMapping("/me")
    public MeResponse me(RequestContext context) {
        UserId userId = identityResolver.currentUserId(context);
        return new MeResponse(
                userId.toString(),
                identityResolver.isAuthenticated(context),
                identityResolver.isTrustedService(context),
                membershipResolver.currentBusinessId(context).map(BusinessId::toString).orElse(null),
                provisioning.businessesOf(context).stream().map(UserBusinessResponse::of).toList());
    }

    @PostMapping("/decisions")
    public DecisionResponse decide(RequestContext context, @Valid @RequestBody DecisionRequest request) {
        ProtectedResource resource = ProtectedResource.parse(request.resource());
        Operation operation = Operation.fromString(request.operation())
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + request.operation()));
        AccessDecision decision;
        if (operation == Operation.UPDATE && request.proposed() != null) {
            decision = authorizer.authorizeUpdate(context, resource,
                    RowPayload.toRowOrEmpty(request.row()), request.proposed().toRow());
        } else {
            decision = authorizer.authorize(context, resource, RowPayload.toRowOrEmpty(request.row()), operation);
        }
        return DecisionResponse.of(resource.qualifiedName(), operation.value(), decision);
    }

    @PostMapping("/hierarchy")
    public Map<String, Object> hierarchy(RequestContext context, @Valid @RequestBody HierarchyRequest request) {
        Role target = Role.fromString(request.targetRole())
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + request.targetRole()));
        Permission permission = Permission.fromString(request.permission())
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + request.permission()));
        boolean allowed = request.businessId() == null || request.businessId().isBlank()
                ? hierarchy.check(context, target, permission)
                : hierarchy.check(context, BusinessId.of(request.businessId()), target, permission);
        return Map.of("targetRole", target.value(), "permission", permission.value(), "allowed", allowed);
    }

    /** Whether any active membership of the caller satisfies {@code role}. */
    @GetMapping("/roles/{role}")
    public Map<String, Object> hasRole(RequestContext context, @PathVariable String role) {
        Role required = Role.fromString(role)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + role));
        return Map.of("role", required.value(), "granted", roleChecker.hasRole(context, required));
    }
}
