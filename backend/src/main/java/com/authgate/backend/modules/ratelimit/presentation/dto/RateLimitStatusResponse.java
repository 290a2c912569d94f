package com.authgate.backend.modules.ratelimit.presentation.dto;

import java.time.Instant;

import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

public record RateLimitStatusResponse(
        String keyType,
        String endpoint,
        String identifier,
        boolean allowed,
        int limit,
        int remaining,
        long windowSeconds,
        Instant resetTime,
        Long retryAfterSeconds
) {

    public static RateLimitStatusResponse from(RateLimitPolicy policy, String identifier, RateLimitResult result) {
        return new RateLimitStatusResponse(
                policy.keyType().value(),
                policy.endpoint(),
                identifier,
                result.allowed(),
                result.limit(),
                result.remaining(),
                result.window().toSeconds(),
                result.resetTime(),
                result.allowed() ? null : result.retryAfterSeconds()
        );
    }
}
