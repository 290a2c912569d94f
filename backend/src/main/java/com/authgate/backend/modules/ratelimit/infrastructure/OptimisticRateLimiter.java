package com.authgate.backend.modules.ratelimit.infrastructure;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.error.StoreUnavailableException;
import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.global.redis.StoreCalls;
import com.authgate.backend.modules.ratelimit.application.RateLimitProperties;
import com.authgate.backend.modules.ratelimit.application.RateLimiter;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Same sliding window as {@link DistributedRateLimiter}, for stores without scripting: the key is WATCHed,
 * read, and the write is committed with MULTI/EXEC. A concurrent writer aborts the transaction and the
 * attempt is repeated.
 */
@Component
@ConditionalOnProperty(prefix = "authgate.rate-limit", name = "strategy", havingValue = "optimistic")
public class OptimisticRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(OptimisticRateLimiter.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisKeyspace keyspace;
    private final int maxAttempts;
    private final Clock clock;

    public OptimisticRateLimiter(StringRedisTemplate redisTemplate, RedisKeyspace keyspace, RateLimitProperties properties, Clock clock) {
        if (properties.getOptimisticMaxAttempts() < 1) {
            throw new IllegalArgumentException("authgate.rate-limit.optimistic-max-attempts must be >= 1");
        }
        this.redisTemplate = redisTemplate;
        this.keyspace = keyspace;
        this.maxAttempts = properties.getOptimisticMaxAttempts();
        this.clock = clock;
    }

    @Override
    public RateLimitResult check(RateLimitPolicy policy, String identifier) {
        String key = windowKey(policy, identifier);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            RateLimitResult result = StoreCalls.execute("ratelimit.check", () -> redisTemplate.execute(new WindowAttempt(key, policy, clock.millis())));
            if (result != null) {
                return result;
            }
            log.debug("Sliding window transaction aborted key={} attempt={}", key, attempt);
        }
        log.warn("Sliding window contention did not settle key={} attempts={}", key, maxAttempts);
        throw new StoreUnavailableException("ratelimit.check", null);
    }

    @Override
    public RateLimitResult status(RateLimitPolicy policy, String identifier) {
        String key = windowKey(policy, identifier);
        long now = clock.millis();
        double lowerBound = now - policy.windowMillis() + 1;
        Long count = StoreCalls.execute("ratelimit.status", () ->
                redisTemplate.opsForZSet().count(key, lowerBound, Double.POSITIVE_INFINITY));
        Set<TypedTuple<String>> oldest = StoreCalls.execute("ratelimit.status", () ->
                redisTemplate.opsForZSet().rangeByScoreWithScores(key, lowerBound, Double.POSITIVE_INFINITY, 0, 1));
        return RateLimitResult.snapshot(policy, count == null ? 0 : count, oldestScore(oldest), now);
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

    private static long oldestScore(Set<TypedTuple<String>> tuples) {
        if (tuples == null || tuples.isEmpty()) {
            return RateLimitResult.NO_MARKER;
        }
        Double score = tuples.iterator().next().getScore();
        return score == null ? RateLimitResult.NO_MARKER : score.longValue();
    }

    /**
     * One WATCH/MULTI/EXEC round. Returns {@code null} when EXEC was aborted by a concurrent writer.
     */
    private static final class WindowAttempt implements SessionCallback<RateLimitResult> {

        private final String key;
        private final RateLimitPolicy policy;
        private final long now;

        private WindowAttempt(String key, RateLimitPolicy policy, long now) {
            this.key = key;
            this.policy = policy;
            this.now = now;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> RateLimitResult execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
            double lowerBound = now - policy.windowMillis() + 1;

            ops.watch(key);
            Long live = ops.opsForZSet().count(key, lowerBound, Double.POSITIVE_INFINITY);
            long count = live == null ? 0 : live;
            Set<TypedTuple<String>> oldestTuple = ops.opsForZSet().rangeByScoreWithScores(key, lowerBound, Double.POSITIVE_INFINITY, 0, 1);
            long oldest = oldestScore(oldestTuple);

            if (count >= policy.limit()) {
                ops.unwatch();
                return RateLimitResult.rejected(policy, oldest, now);
            }

            ops.multi();
            ops.opsForZSet().removeRangeByScore(key, Double.NEGATIVE_INFINITY, now - policy.windowMillis());
            ops.opsForZSet().add(key, now + ":" + UUID.randomUUID(), now);
            ops.expire(key, policy.windowMillis(), TimeUnit.MILLISECONDS);
            List<Object> committed = ops.exec();
            if (committed == null || committed.isEmpty()) {
                return null;
            }
            return RateLimitResult.admitted(policy, count, oldest == RateLimitResult.NO_MARKER ? now : oldest, now);
        }
    }
}
