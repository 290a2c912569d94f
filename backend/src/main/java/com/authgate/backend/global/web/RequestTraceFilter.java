package com.authgate.backend.global.web;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the request id and the resolved client address into the MDC and onto the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CLIENT_IP_ATTRIBUTE = RequestTraceFilter.class.getName() + ".clientIp";
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final String CLIENT_IP_MDC_KEY = "clientIp";

    private final boolean trustForwardedFor;

    public RequestTraceFilter(@Value("${authgate.web.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        String clientIp = resolveClientIp(request);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        MDC.put(CLIENT_IP_MDC_KEY, clientIp);
        request.setAttribute(REQUEST_ID_HEADER, requestId);
        request.setAttribute(CLIENT_IP_ATTRIBUTE, clientIp);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
            MDC.remove(CLIENT_IP_MDC_KEY);
        }
    }

    /**
     * Client address as resolved by this filter, or the socket peer when the filter did not run.
     */
    public static String clientIp(HttpServletRequest request) {
        Object resolved = request.getAttribute(CLIENT_IP_ATTRIBUTE);
        return resolved instanceof String ip ? ip : request.getRemoteAddr();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header)) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwarded)) {
                // 첫 번째 값이 원래 클라이언트
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
