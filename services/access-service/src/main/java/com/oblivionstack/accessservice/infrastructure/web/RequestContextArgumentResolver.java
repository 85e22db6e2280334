package com.oblivionstack.accessservice.infrastructure.web;

import com.oblivionstack.observability.CorrelationContextHolder;
import com.oblivionstack.security.IdentityResolver;
import com.oblivionstack.security.RequestContext;
import com.oblivionstack.security.RequestMetadata;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.VerifiedClaims;
import com.oblivionstack.security.VerifiedClaimsCodec;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link RequestContext} for controller methods that declare one, from the envelope the
 * gateway forwards:
 *
 * <ul>
 *   <li>{@code X-Verified-Claims}: Base64url JSON claims, already verified upstream
 *   <li>{@code X-Real-IP}: client address, falling back to the socket peer
 *   <li>{@code User-Agent} and {@code X-Request-ID}
 * </ul>
 *
 * A missing or malformed claims header yields an anonymous context; it is never an error.
 */
public class RequestContextArgumentResolver implements HandlerMethodArgumentResolver {

    private static final Logger log = LoggerFactory.getLogger(RequestContextArgumentResolver.class);

    public static final String CLAIMS_HEADER = "X-Verified-Claims";
    public static final String REAL_IP_HEADER = "X-Real-IP";

    private final IdentityResolver identityResolver;

    public RequestContextArgumentResolver(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return RequestContext.class.equals(parameter.getParameterType());
    }

    @Override
    public RequestContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            return RequestContext.anonymous();
        }
        return resolve(request);
    }

    RequestContext resolve(HttpServletRequest request) {
        String header = request.getHeader(CLAIMS_HEADER);
        VerifiedClaims claims = VerifiedClaimsCodec.tryDecode(header).orElse(null);
        if (claims == null && header != null && !header.isBlank()) {
            log.warn("Ignoring malformed {} header", CLAIMS_HEADER);
        }

        String ip = request.getHeader(REAL_IP_HEADER);
        RequestMetadata metadata = new RequestMetadata(
                ip == null || ip.isBlank() ? request.getRemoteAddr() : ip.strip(),
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(CorrelationIdFilter.REQUEST_ID_HEADER));
        RequestContext context = new RequestContext(claims, metadata);

        UserId userId = identityResolver.currentUserId(context);
        if (!userId.isNil()) {
            CorrelationContextHolder.update(current -> current.withUserId(userId.toString()));
        }
        return context;
    }
}
