package com.authgate.backend.modules.ratelimit.application;

import java.time.Clock;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.error.StoreUnavailableException;
import com.authgate.backend.modules.ratelimit.domain.KeyType;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for request admission. Resolves the policy, runs the limiter and turns a rejection into
 * {@link RateLimitExceededException}. When the store is down the request is rejected unless
 * {@code authgate.rate-limit.fail-open} is set.
 */
@Service
public class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final RateLimiter rateLimiter;
    private final RateLimitPolicies policies;
    private final boolean failOpen;
    private final Clock clock;

    public RateLimitGuard(RateLimiter rateLimiter, RateLimitPolicies policies, RateLimitProperties properties, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
        this.failOpen = properties.isFailOpen();
        this.clock = clock;
    }

    public RateLimitResult checkIp(String endpoint, String ipAddress) {
        return check(KeyType.IP, endpoint, ipAddress);
    }

    public RateLimitResult checkUser(String endpoint, String userId) {
        return check(KeyType.USER, endpoint, userId);
    }

    public RateLimitResult check(KeyType keyType, String endpoint, String identifier) {
        if (!StringUtils.hasText(identifier)) {
            throw ProblemException.invalidArgument("identifier must not be blank");
        }
        RateLimitPolicy policy = policies.resolve(keyType, endpoint);
        RateLimitResult result;
        try {
            result = rateLimiter.check(policy, identifier);
        } catch (StoreUnavailableException ex) {
            if (!failOpen) {
                throw ex;
            }
            log.warn("[ALERT][RateLimit] store unavailable, admitting request endpoint={} keyType={}",
                    endpoint, keyType.value());
            return RateLimitResult.unlimited(policy, clock.millis());
        }
        if (!result.allowed()) {
            log.info("Rate limit exceeded endpoint={} keyType={} identifier={} retryAfterSeconds={}",
                    endpoint, keyType.value(), identifier, result.retryAfterSeconds());
            throw new RateLimitExceededException(endpoint, result);
        }
        return result;
    }
}
