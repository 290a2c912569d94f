package com.authgate.backend.modules.ratelimit.application;

import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

/**
 * Sliding-window admission control keyed by {@code (keyType, endpoint, identifier)}.
 * Implementations keep no local counters; store failures surface as
 * {@link com.authgate.backend.global.error.StoreUnavailableException}.
 */
public interface RateLimiter {

    /**
     * Records the request if it fits in the window. Prune, count and insert happen as one atomic step in the store.
     */
    RateLimitResult check(RateLimitPolicy policy, String identifier);

    /**
     * Current state of the window without recording anything.
     */
    RateLimitResult status(RateLimitPolicy policy, String identifier);

    void reset(RateLimitPolicy policy, String identifier);
}
