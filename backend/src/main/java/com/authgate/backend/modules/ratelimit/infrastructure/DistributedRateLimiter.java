package com.authgate.backend.modules.ratelimit.infrastructure;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.global.redis.StoreCalls;
import com.authgate.backend.modules.ratelimit.application.RateLimiter;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Sliding window over a sorted set of hit markers, evaluated by a Lua script so prune, count and insert
 * are one atomic step on the server.
 */
@Component
@ConditionalOnProperty(prefix = "authgate.rate-limit", name = "strategy", havingValue = "script", matchIfMissing = true)
public class DistributedRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(DistributedRateLimiter.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisKeyspace keyspace;
    private final RedisScript<List<Long>> acquireScript;
    private final RedisScript<List<Long>> statusScript;
    private final Clock clock;

    public DistributedRateLimiter(
            StringRedisTemplate redisTemplate,
            RedisKeyspace keyspace,
            @Qualifier("slidingWindowAcquireScript") RedisScript<List<Long>> acquireScript,
            @Qualifier("slidingWindowStatusScript") RedisScript<List<Long>> statusScript,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.keyspace = keyspace;
        this.acquireScript = acquireScript;
        this.statusScript = statusScript;
        this.clock = clock;
    }

    @Override
    public RateLimitResult check(RateLimitPolicy policy, String identifier) {
        String key = windowKey(policy, identifier);
        long now = clock.millis();
        // 같은 밀리초의 요청끼리 덮어쓰지 않도록 marker는 항상 유일해야 한다.
        String marker = now + ":" + UUID.randomUUID();
        List<Long> reply = StoreCalls.execute("ratelimit.check", () -> redisTemplate.execute(
                acquireScript,
                List.of(key),
                String.valueOf(now),
                String.valueOf(policy.windowMillis()),
                String.valueOf(policy.limit()),
                marker));

        if (reply == null || reply.size() < 3) {
            throw new IllegalStateException("Unexpected sliding window reply for key " + key + ": " + reply);
        }
        boolean allowed = valueAt(reply, 0) == 1L;
        long count = valueAt(reply, 1);
        long oldest = valueAt(reply, 2);

        if (allowed) {
            return RateLimitResult.admitted(policy, count, oldest, now);
        }
        log.debug("Sliding window full key={} count={} limit={}", key, count, policy.limit());
        return RateLimitResult.rejected(policy, oldest, now);
    }

    @Override
    public RateLimitResult status(RateLimitPolicy policy, String identifier) {
        String key = windowKey(policy, identifier);
        long now = clock.millis();
        List<Long> reply = StoreCalls.execute("ratelimit.status", () -> redisTemplate.execute(
                statusScript,
                List.of(key),
                String.valueOf(now),
                String.valueOf(policy.windowMillis())));

        if (reply == null || reply.size() < 2) {
            return RateLimitResult.snapshot(policy, 0, RateLimitResult.NO_MARKER, now);
        }
        return RateLimitResult.snapshot(policy, valueAt(reply, 0), valueAt(reply, 1), now);
    }

    @Override
    public void reset(RateLimitPolicy policy, String identifier) {
        String key = windowKey(policy, identifier);
        StoreCalls.run("ratelimit.reset", () -> redisTemplate.delete(key));
        log.info("Rate limit window reset key={}", key);
    }

    private String windowKey(RateLimitPolicy policy, String identifier) {
        if (!StringUtils.hasText(identifier)) {
            throw ProblemException.invalidArgument("identifier must not be blank");
        }
        return keyspace.rateLimit(policy.keyType().value(), policy.endpoint(), identifier);
    }

    private static long valueAt(List<Long> reply, int index) {
        Long value = reply.get(index);
        return value == null ? RateLimitResult.NO_MARKER : value;
    }
}
