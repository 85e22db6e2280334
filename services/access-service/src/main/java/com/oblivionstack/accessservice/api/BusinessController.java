package com.oblivionstack.accessservice.api;

import com.oblivionstack.accessservice.domain.AuditLogService;
import com.oblivionstack.accessservice.domain.TenantProvisioningService;
import com.oblivionstack.audit.AuditRecord;
import com.oblivionstack.observability.CorrelationContextHolder;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.tenant.Business;
import com.oblivionstack.security.tenant.Industry;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Business and membership provisioning, and the business's audit trail. Requests naming a
 * business carry its id as {@code tenantId} in the log context.
 */
@RestController
@RequestMapping("/api/v1/businesses")
public class BusinessController {

    private final TenantProvisioningService provisioning;
    private final AuditLogService auditLogs;

    public BusinessController(TenantProvisioningService provisioning, AuditLogService auditLogs) {
        this.provisioning = provisioning;
        this.auditLogs = auditLogs;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BusinessResponse signup(RequestContext context, @Valid @RequestBody SignupRequest request) {
        Industry industry = Industry.fromString(request.industry())
                .orElseThrow(() -> new IllegalArgumentException("Unknown industry: " + request.industry()));
        Business business = provisioning.signup(context, request.name(), request.slug(), industry, request.email());
        tagTenant(business.id());
        return BusinessResponse.of(business);
    }

    @GetMapping("/{businessId}")
    public BusinessResponse business(RequestContext context, @PathVariable String businessId) {
        return BusinessResponse.of(provisioning.business(context, tenant(businessId)));
    }

    @DeleteMapping("/{businessId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(RequestContext context, @PathVariable String businessId) {
        provisioning.softDelete(context, tenant(businessId));
    }

    @GetMapping("/{businessId}/members")
    public List<MembershipResponse> members(RequestContext context, @PathVariable String businessId) {
        return provisioning.members(context, tenant(businessId)).stream()
                .map(MembershipResponse::of)
                .toList();
    }

    @PostMapping("/{businessId}/members")
    @ResponseStatus(HttpStatus.CREATED)
    public MembershipResponse invite(RequestContext context, @PathVariable String businessId,
                                     @Valid @RequestBody InviteRequest request) {
        Role role = Role.fromString(request.role())
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + request.role()));
        return MembershipResponse.of(provisioning.invite(context, tenant(businessId),
                UserId.of(request.userId()), role));
    }

    /** Accepts the caller's own pending invitation. */
    @PostMapping("/{businessId}/members/accept")
    public MembershipResponse accept(RequestContext context, @PathVariable String businessId) {
        return MembershipResponse.of(provisioning.accept(context, tenant(businessId)));
    }

    @DeleteMapping("/{businessId}/members/{userId}")
    public MembershipResponse deactivate(RequestContext context, @PathVariable String businessId,
                                         @PathVariable String userId) {
        return MembershipResponse.of(provisioning.deactivate(context, tenant(businessId),
                UserId.of(userId)));
    }

    @GetMapping("/{businessId}/audit-logs")
    public List<AuditRecord> auditLogs(RequestContext context, @PathVariable String businessId,
                                       @RequestParam(defaultValue = "50") int limit) {
        return auditLogs.recent(context, tenant(businessId), limit);
    }

    /** Parses the path's business id and tags the request's log context with it. */
    static BusinessId tenant(String businessId) {
        BusinessId id = BusinessId.of(businessId);
        tagTenant(id);
        return id;
    }

    private static void tagTenant(BusinessId businessId) {
        CorrelationContextHolder.update(current -> current.withTenantId(businessId.toString()));
    }
}
