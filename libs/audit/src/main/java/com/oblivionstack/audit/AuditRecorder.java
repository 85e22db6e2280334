package com.oblivionstack.audit;

import com.oblivionstack.observability.CorrelationContext;
import com.oblivionstack.observability.CorrelationContextHolder;
import com.oblivionstack.observability.SensitiveDataRedactor;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.RequestMetadata;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.MembershipResolver;
import com.oblivionstack.security.policy.ProtectedResource;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds audit records for mutations of protected resources and hands them to an
 * {@link AuditSink}.
 * <p>
 * The actor comes from the request context; the nil identity is stored as "no user". The
 * business is the row's own business when the caller knows it, otherwise the caller's current
 * business. Row snapshots are redacted before they leave this class.
 */
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final MembershipResolver membershipResolver;
    private final SensitiveDataRedactor redactor;
    private final AuditSink sink;
    private final Clock clock;

    public AuditRecorder(MembershipResolver membershipResolver, SensitiveDataRedactor redactor, AuditSink sink) {
        this(membershipResolver, redactor, sink, Clock.systemUTC());
    }

    public AuditRecorder(MembershipResolver membershipResolver, SensitiveDataRedactor redactor,
                         AuditSink sink, Clock clock) {
        this.membershipResolver = Objects.requireNonNull(membershipResolver, "membershipResolver");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuditRecord inserted(RequestContext context, ProtectedResource resource, String recordId,
                                BusinessId businessId, Map<String, Object> newData) {
        return record(context, resource, recordId, businessId, AuditAction.INSERT, null, newData);
    }

    public AuditRecord updated(RequestContext context, ProtectedResource resource, String recordId,
                               BusinessId businessId, Map<String, Object> oldData, Map<String, Object> newData) {
        return record(context, resource, recordId, businessId, AuditAction.UPDATE, oldData, newData);
    }

    public AuditRecord deleted(RequestContext context, ProtectedResource resource, String recordId,
                               BusinessId businessId, Map<String, Object> oldData) {
        return record(context, resource, recordId, businessId, AuditAction.DELETE, oldData, null);
    }

    /**
     * Builds, validates and writes one record.
     *
     * @throws IllegalArgumentException if the record is incomplete for its action
     */
    public AuditRecord record(RequestContext context, ProtectedResource resource, String recordId,
                              BusinessId businessId, AuditAction action,
                              Map<String, Object> oldData, Map<String, Object> newData) {
        RequestContext ctx = context == null ? RequestContext.anonymous() : context;
        UserId actor = membershipResolver.identityResolver().currentUserId(ctx);
        BusinessId business = businessId != null ? businessId : membershipResolver.currentBusinessId(ctx).orElse(null);
        RequestMetadata metadata = ctx.metadata();

        AuditRecord record = new AuditRecord(
                UUID.randomUUID(),
                resource.qualifiedName(),
                recordId,
                action,
                actor.isNil() ? null : actor.value(),
                business == null ? null : business.value(),
                redactor.redact(oldData),
                redactor.redact(newData),
                action == AuditAction.UPDATE ? changedFields(oldData, newData) : null,
                metadata.ipAddress(),
                metadata.userAgent(),
                requestId(metadata),
                clock.instant());

        ValidationResult validation = AuditRecordValidator.validate(record);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid audit record for " + resource + ": " + validation.errors());
        }
        sink.write(record);
        log.debug("Audited {} on {} record {}", action, resource, recordId);
        return record;
    }

    /**
     * Names of fields whose values differ between the two snapshots, including fields present in
     * only one of them. Sorted.
     */
    static List<String> changedFields(Map<String, Object> oldData, Map<String, Object> newData) {
        Map<String, Object> before = oldData == null ? Map.of() : oldData;
        Map<String, Object> after = newData == null ? Map.of() : newData;
        Set<String> keys = new TreeSet<>(before.keySet());
        keys.addAll(after.keySet());
        return keys.stream()
                .filter(key -> before.containsKey(key) != after.containsKey(key)
                        || !Objects.equals(before.get(key), after.get(key)))
                .collect(Collectors.toList());
    }

    private static String requestId(RequestMetadata metadata) {
        if (metadata.requestId() != null) {
            return metadata.requestId();
        }
        return CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null);
    }
}
