package com.authgate.backend.modules.ratelimit.domain;

import java.time.Duration;

import com.authgate.backend.global.error.ProblemException;

public record RateLimitPolicy(int limit, Duration window, KeyType keyType, String endpoint) {

    public RateLimitPolicy {
        if (limit < 1) {
            throw ProblemException.invalidArgument("limit must be >= 1");
        }
        if (window == null || window.toMillis() < 1) {
            throw ProblemException.invalidArgument("window must be at least 1ms");
        }
        if (keyType == null) {
            throw ProblemException.invalidArgument("keyType is required");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw ProblemException.invalidArgument("endpoint must not be blank");
        }
    }

    public long windowMillis() {
        return window.toMillis();
    }
}
