package com.authgate.backend.modules.ratelimit.presentation;

import java.util.Optional;

import com.authgate.backend.global.security.JwtAuthenticationPrincipal;
import com.authgate.backend.global.security.SecurityUtils;
import com.authgate.backend.global.web.RequestTraceFilter;
import com.authgate.backend.modules.ratelimit.application.RateLimitExceededException;
import com.authgate.backend.modules.ratelimit.application.RateLimitGuard;
import com.authgate.backend.modules.ratelimit.application.RateLimitPolicies;
import com.authgate.backend.modules.ratelimit.application.RateLimitProperties;
import com.authgate.backend.modules.ratelimit.domain.KeyType;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the configured route policies before the handler runs. Quota headers are written on every limited
 * response; a rejection propagates as {@link RateLimitExceededException} and is rendered as 429.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitGuard rateLimitGuard;
    private final RateLimitPolicies policies;

    public RateLimitInterceptor(RateLimitGuard rateLimitGuard, RateLimitPolicies policies) {
        this.rateLimitGuard = rateLimitGuard;
        this.policies = policies;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        Optional<RateLimitProperties.Route> route = policies.routeFor(request.getRequestURI().substring(request.getContextPath().length()));
        if (route.isEmpty()) {
            return true;
        }

        String endpoint = route.get().getEndpoint();
        Optional<JwtAuthenticationPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        KeyType keyType = route.get().getKeyType();
        if (keyType == null || principal.isEmpty()) {
            // 인증 정보가 없으면 IP 기준으로 제한한다.
            keyType = principal.isPresent() ? KeyType.USER : KeyType.IP;
        }
        String identifier = keyType == KeyType.USER ? principal.get().userId() : RequestTraceFilter.clientIp(request);

        try {
            RateLimitResult result = rateLimitGuard.check(keyType, endpoint, identifier);
            writeHeaders(response, result);
        } catch (RateLimitExceededException ex) {
            writeHeaders(response, ex.getResult());
            throw ex;
        }
        return true;
    }

    static void writeHeaders(HttpServletResponse response, RateLimitResult result) {
        response.setHeader(LIMIT_HEADER, String.valueOf(result.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(result.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(result.resetTime().getEpochSecond()));
    }
}
