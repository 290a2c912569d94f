package com.authgate.backend.modules.ratelimit.application;

import com.authgate.backend.global.error.RetryableProblemException;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends RetryableProblemException {

    private final transient RateLimitResult result;

    public RateLimitExceededException(String endpoint, RateLimitResult result) {
        super(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Rate limit exceeded for " + endpoint, result.retryAfterSeconds());
        this.result = result;
    }

    public RateLimitResult getResult() {
        return result;
    }
}
