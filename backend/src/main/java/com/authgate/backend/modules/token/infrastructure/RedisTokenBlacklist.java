package com.authgate.backend.modules.token.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.global.redis.StoreCalls;
import com.authgate.backend.modules.token.application.TokenBlacklist;
import com.authgate.backend.modules.token.domain.BlacklistEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Two independent structures:
 * <ul>
 *   <li>{@code blacklist:token:<id>} JSON {@link BlacklistEntry}, TTL = remaining token validity</li>
 *   <li>{@code blacklist:global} sorted set of ids scored by expiry millis; members count only while the score is
 *       in the future, and the key itself expires with its latest member</li>
 * </ul>
 */
@Component
public class RedisTokenBlacklist implements TokenBlacklist {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenBlacklist.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisKeyspace keyspace;
    private final RedisScript<Long> globalAddScript;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisTokenBlacklist(
            StringRedisTemplate redisTemplate,
            RedisKeyspace keyspace,
            @Qualifier("blacklistGlobalAddScript") RedisScript<Long> globalAddScript,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.keyspace = keyspace;
        this.globalAddScript = globalAddScript;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean add(String tokenId, String reason, Instant expiresAt) {
        requireTokenId(tokenId);
        if (expiresAt == null) {
            throw ProblemException.invalidArgument("expiresAt is required");
        }
        Instant now = clock.instant();
        Duration ttl = Duration.between(now, expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            log.debug("Skipping blacklist for already expired token tokenId={}", tokenId);
            return false;
        }

        String payload = serialize(new BlacklistEntry(tokenId, reason, now, expiresAt));
        Boolean created = StoreCalls.execute("blacklist.add", () ->
                redisTemplate.opsForValue().setIfAbsent(keyspace.blacklistedToken(tokenId), payload, ttl));

        // 추가, 정리, 키 만료 연장을 한 번에 실행해 동시 등록이 만료 시각을 앞당기지 못하게 한다.
        StoreCalls.run("blacklist.global.add", () -> redisTemplate.execute(
                globalAddScript,
                List.of(keyspace.blacklistGlobal()),
                tokenId,
                String.valueOf(expiresAt.toEpochMilli()),
                String.valueOf(now.toEpochMilli())));

        boolean newlyRevoked = Boolean.TRUE.equals(created);
        if (newlyRevoked) {
            log.info("Token blacklisted tokenId={} reason={} expiresAt={}", tokenId, reason, expiresAt);
        } else {
            log.debug("Token was already blacklisted tokenId={}", tokenId);
        }
        return newlyRevoked;
    }

    @Override
    public boolean contains(String tokenId) {
        requireTokenId(tokenId);
        Double expiryScore = StoreCalls.execute("blacklist.global.score", () ->
                redisTemplate.opsForZSet().score(keyspace.blacklistGlobal(), tokenId));
        if (expiryScore != null && expiryScore > clock.millis()) {
            return true;
        }
        return Boolean.TRUE.equals(StoreCalls.execute("blacklist.exists", () ->
                redisTemplate.hasKey(keyspace.blacklistedToken(tokenId))));
    }

    @Override
    public void remove(String tokenId) {
        requireTokenId(tokenId);
        StoreCalls.run("blacklist.remove", () -> {
            redisTemplate.delete(keyspace.blacklistedToken(tokenId));
            redisTemplate.opsForZSet().remove(keyspace.blacklistGlobal(), tokenId);
        });
        log.info("Token removed from blacklist tokenId={}", tokenId);
    }

    @Override
    public Optional<BlacklistEntry> find(String tokenId) {
        requireTokenId(tokenId);
        String payload = StoreCalls.execute("blacklist.find", () ->
                redisTemplate.opsForValue().get(keyspace.blacklistedToken(tokenId)));
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload, BlacklistEntry.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable blacklist entry for token " + tokenId, ex);
        }
    }

    @Override
    public long size() {
        String globalKey = keyspace.blacklistGlobal();
        long nowMillis = clock.millis();
        Long count = StoreCalls.execute("blacklist.global.count", () ->
                redisTemplate.opsForZSet().count(globalKey, nowMillis + 1, Double.POSITIVE_INFINITY));
        return count == null ? 0 : count;
    }

    @Override
    public int purgeExpired() {
        Long removed = StoreCalls.execute("blacklist.global.purge", () ->
                redisTemplate.opsForZSet().removeRangeByScore(keyspace.blacklistGlobal(), Double.NEGATIVE_INFINITY, clock.millis()));
        return removed == null ? 0 : removed.intValue();
    }

    private String serialize(BlacklistEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize blacklist entry " + entry.tokenId(), ex);
        }
    }

    private static void requireTokenId(String tokenId) {
        if (!StringUtils.hasText(tokenId)) {
            throw ProblemException.invalidArgument("tokenId must not be blank");
        }
    }
}
