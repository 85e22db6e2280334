package com.oblivionstack.observability;

/**
 * Immutable correlation context that flows with a request through the access layer.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext}. Its values are copied into
 * SLF4J MDC by {@link CorrelationContextHolder} so that authorization decisions, cache refreshes
 * and audit writes logged on the request thread can be tied back to the caller.
 *
 * @param correlationId unique ID for the business flow (propagated via {@code X-Correlation-ID})
 * @param tenantId      business (tenant) the request is acting in, when known
 * @param userId        resolved caller identity (nullable for anonymous or system work)
 * @param requestId     unique ID for this specific request, as forwarded by the gateway
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Returns a copy with the given user ID. */
    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, tenantId, newUserId, requestId);
    }

    /** Returns a copy with the given tenant ID. */
    public CorrelationContext withTenantId(String newTenantId) {
        return new CorrelationContext(correlationId, newTenantId, userId, requestId);
    }
}
