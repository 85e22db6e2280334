package com.oblivionstack.security;

/**
 * Request metadata forwarded by the request pipeline and copied into audit records.
 *
 * @param ipAddress client address as reported by the edge ({@code X-Real-IP}), nullable
 * @param userAgent client user agent, nullable
 * @param requestId gateway request id, nullable
 */
public record RequestMetadata(String ipAddress, String userAgent, String requestId) {

    private static final RequestMetadata EMPTY = new RequestMetadata(null, null, null);

    /** Metadata with every field absent. */
    public static RequestMetadata empty() {
        return EMPTY;
    }
}
