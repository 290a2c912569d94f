package com.authgate.backend.modules.ratelimit.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one admission decision. {@code retryAfter} is set only when the request was rejected.
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        int limit,
        Duration window,
        Instant resetTime,
        Duration retryAfter
) {

    /** Marker score used by the store scripts when the window is empty. */
    public static final long NO_MARKER = -1L;

    /**
     * @param countBefore markers in the window before this request was recorded
     * @param oldestMillis score of the oldest marker still in the window, including the one just added
     */
    public static RateLimitResult admitted(RateLimitPolicy policy, long countBefore, long oldestMillis, long nowMillis) {
        int remaining = (int) Math.max(policy.limit() - countBefore - 1, 0);
        return new RateLimitResult(true, remaining, policy.limit(), policy.window(),
                resetTime(policy, oldestMillis, nowMillis), null);
    }

    public static RateLimitResult rejected(RateLimitPolicy policy, long oldestMillis, long nowMillis) {
        Instant reset = resetTime(policy, oldestMillis, nowMillis);
        Duration retryAfter = Duration.ofMillis(Math.max(reset.toEpochMilli() - nowMillis, 0));
        return new RateLimitResult(false, 0, policy.limit(), policy.window(), reset, retryAfter);
    }

    /**
     * Read-only view of the window; an empty or missing window means the full quota is available.
     */
    public static RateLimitResult snapshot(RateLimitPolicy policy, long count, long oldestMillis, long nowMillis) {
        if (count < policy.limit()) {
            int remaining = (int) (policy.limit() - count);
            Instant reset = oldestMillis == NO_MARKER ? Instant.ofEpochMilli(nowMillis) : resetTime(policy, oldestMillis, nowMillis);
            return new RateLimitResult(true, remaining, policy.limit(), policy.window(), reset, null);
        }
        return rejected(policy, oldestMillis, nowMillis);
    }

    public static RateLimitResult unlimited(RateLimitPolicy policy, long nowMillis) {
        return new RateLimitResult(true, policy.limit(), policy.limit(), policy.window(),
                Instant.ofEpochMilli(nowMillis), null);
    }

    /**
     * Whole seconds to wait, rounded up so a client never retries early.
     */
    public long retryAfterSeconds() {
        if (retryAfter == null) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        return (millis + 999) / 1000;
    }

    private static Instant resetTime(RateLimitPolicy policy, long oldestMillis, long nowMillis) {
        long base = oldestMillis == NO_MARKER ? nowMillis : oldestMillis;
        return Instant.ofEpochMilli(base + policy.windowMillis());
    }
}
