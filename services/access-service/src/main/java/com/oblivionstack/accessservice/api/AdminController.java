package com.oblivionstack.accessservice.api;

import com.oblivionstack.accessservice.domain.NotFoundException;
import com.oblivionstack.accessservice.infrastructure.scheduling.MembershipViewRefresher;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.membership.CachedMembershipView;
import com.oblivionstack.security.membership.CachedMembershipView.RefreshResult;
import com.oblivionstack.security.policy.PolicyRegistry;
import com.oblivionstack.security.policy.ProtectedResource;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints, open to the trusted service principal only. Other callers get 404.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final IdentityResolver identityResolver;
    private final MembershipViewRefresher refresher;
    private final CachedMembershipView view;
    private final PolicyRegistry registry;

    public AdminController(IdentityResolver identityResolver, MembershipViewRefresher refresher,
                           CachedMembershipView view, PolicyRegistry registry) {
        this.identityResolver = identityResolver;
        this.refresher = refresher;
        this.view = view;
        this.registry = registry;
    }

    @PostMapping("/membership-view/refresh")
    public RefreshResult refreshMembershipView(RequestContext context) {
        requireTrustedService(context);
        return refresher.refresh();
    }

    @GetMapping("/membership-view")
    public Map<String, Object> membershipView(RequestContext context) {
        requireTrustedService(context);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entries", view.size());
        body.put("refreshedAt", view.refreshedAt().map(Instant::toString).orElse(null));
        return body;
    }

    /** Policy names per policed resource, by qualified name. */
    @GetMapping("/policies")
    public Map<String, List<String>> policies(RequestContext context) {
        requireTrustedService(context);
        Map<String, List<String>> body = new LinkedHashMap<>();
        registry.resources().stream()
                .sorted(Comparator.comparing(ProtectedResource::qualifiedName))
                .forEach(resource -> body.put(resource.qualifiedName(), registry.policyNames(resource)));
        return body;
    }

    private void requireTrustedService(RequestContext context) {
        if (!identityResolver.isTrustedService(context)) {
            throw new NotFoundException("Not found");
        }
    }
}
