package com.oblivionstack.accessservice.config;

import com.oblivionstack.accessservice.domain.AuditLogService;
import com.oblivionstack.accessservice.domain.PolicyCatalog;
import com.oblivionstack.accessservice.domain.TenantProvisioningService;
import com.oblivionstack.audit.AuditLogReader;
import com.oblivionstack.audit.AuditRecorder;
import com.oblivionstack.audit.AuditSink;
import com.oblivionstack.audit.CompositeAuditSink;
import com.oblivionstack.audit.InMemoryAuditSink;
import com.oblivionstack.audit.LoggingAuditSink;
import com.oblivionstack.database.migration.TenancyDatabaseConfig;
import com.oblivionstack.observability.MetricFactory;
import com.oblivionstack.observability.SensitiveDataRedactor;
import com.oblivionstack.security.HierarchicalAccessEvaluator;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RoleChecker;
import com.oblivionstack.security.membership.CachedMembershipView;
import com.oblivionstack.security.membership.InMemoryMembershipRepository;
import com.oblivionstack.security.membership.MembershipRepository;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.policy.PolicyAuthorizer;
import com.oblivionstack.security.policy.PolicyRegistry;
import com.oblivionstack.security.policy.RowLevelGuard;
import com.oblivionstack.security.tenant.BusinessRepository;
import com.oblivionstack.security.tenant.InMemoryBusinessRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires the authorization library into the service.
 *
 * <p>With {@code oblivion.database.enabled=true} memberships, businesses and audit records live in
 * the tenancy database ({@link TenancyDatabaseConfig}); otherwise in memory, which is what local
 * runs and most tests use.
 */
@Configuration
@Import(TenancyDatabaseConfig.class)
public class AuthorizationConfig {

    static final String COMPONENT = "access-service";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry) {
        return new MetricFactory(registry, COMPONENT);
    }

    @Bean
    public IdentityResolver identityResolver(Clock clock, AccessServiceProperties properties) {
        return new IdentityResolver(clock, properties.trustedServicePrincipal());
    }

    @Bean
    public MembershipResolver membershipResolver(MembershipRepository membershipRepository,
                                                 IdentityResolver identityResolver) {
        return new MembershipResolver(membershipRepository, identityResolver);
    }

    @Bean
    public RoleChecker roleChecker(MembershipResolver membershipResolver) {
        return new RoleChecker(membershipResolver);
    }

    @Bean
    public HierarchicalAccessEvaluator hierarchicalAccessEvaluator(MembershipResolver membershipResolver) {
        return new HierarchicalAccessEvaluator(membershipResolver);
    }

    /** The registry with the built-in tenancy policies and every configured resource applied. */
    @Bean
    public PolicyRegistry policyRegistry(AccessServiceProperties properties) {
        PolicyRegistry registry = new PolicyRegistry();
        PolicyCatalog.install(registry, properties.resources().stream()
                .map(AccessServiceProperties.ResourceEntry::toDefinition)
                .toList());
        return registry;
    }

    @Bean
    public PolicyAuthorizer policyAuthorizer(PolicyRegistry policyRegistry, MembershipResolver membershipResolver,
                                             MetricFactory metricFactory) {
        return new PolicyAuthorizer(policyRegistry, membershipResolver, metricFactory);
    }

    @Bean
    public RowLevelGuard rowLevelGuard(PolicyAuthorizer policyAuthorizer) {
        return new RowLevelGuard(policyAuthorizer);
    }

    @Bean
    public CachedMembershipView cachedMembershipView(MembershipRepository membershipRepository,
                                                     MetricFactory metricFactory, Clock clock) {
        return new CachedMembershipView(membershipRepository, metricFactory, clock);
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    /** Stored records go to the primary sink; every record is also written to the AUDIT log. */
    @Bean
    public AuditRecorder auditRecorder(MembershipResolver membershipResolver, SensitiveDataRedactor redactor,
                                       AuditSink auditSink, Clock clock) {
        AuditSink sinks = new CompositeAuditSink(List.of(auditSink, new LoggingAuditSink()));
        return new AuditRecorder(membershipResolver, redactor, sinks, clock);
    }

    @Bean
    public TenantProvisioningService tenantProvisioningService(
            BusinessRepository businessRepository, MembershipRepository membershipRepository,
            IdentityResolver identityResolver, HierarchicalAccessEvaluator hierarchicalAccessEvaluator,
            PolicyAuthorizer policyAuthorizer, AuditRecorder auditRecorder, Clock clock) {
        return new TenantProvisioningService(businessRepository, membershipRepository, identityResolver,
                hierarchicalAccessEvaluator, policyAuthorizer, auditRecorder, clock);
    }

    @Bean
    public AuditLogService auditLogService(AuditLogReader auditLogReader, RowLevelGuard rowLevelGuard) {
        return new AuditLogService(auditLogReader, rowLevelGuard);
    }

    /** In-memory stores, used when the tenancy database is disabled. */
    @Configuration
    @ConditionalOnProperty(prefix = "oblivion.database", name = "enabled", havingValue = "false", matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        public InMemoryMembershipRepository inMemoryMembershipRepository(Clock clock) {
            return new InMemoryMembershipRepository(clock);
        }

        @Bean
        public InMemoryBusinessRepository inMemoryBusinessRepository() {
            return new InMemoryBusinessRepository();
        }

        @Bean
        public InMemoryAuditSink inMemoryAuditSink() {
            return new InMemoryAuditSink();
        }
    }
}
