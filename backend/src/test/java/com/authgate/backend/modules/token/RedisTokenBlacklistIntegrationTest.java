package com.authgate.backend.modules.token;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.modules.token.application.TokenBlacklist;
import com.authgate.backend.modules.token.domain.BlacklistEntry;
import com.authgate.backend.modules.token.domain.RevocationReason;
import com.authgate.backend.support.AbstractRedisIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RedisTokenBlacklistIntegrationTest extends AbstractRedisIntegrationTest {

    @Autowired
    private TokenBlacklist tokenBlacklist;

    @Autowired
    private RedisKeyspace keyspace;

    @Autowired
    private Clock clock;

    @Test
    @DisplayName("같은 토큰은 한 번만 새로 블랙리스트에 등록된다")
    void onlyFirstAddCreatesTheEntry() {
        Instant expiresAt = clock.instant().plus(Duration.ofMinutes(10));

        assertThat(tokenBlacklist.add("jti-1", RevocationReason.ROTATED, expiresAt)).isTrue();
        assertThat(tokenBlacklist.add("jti-1", RevocationReason.LOGOUT, expiresAt)).isFalse();

        assertThat(tokenBlacklist.contains("jti-1")).isTrue();
        BlacklistEntry entry = tokenBlacklist.find("jti-1").orElseThrow();
        assertThat(entry.reason()).isEqualTo(RevocationReason.ROTATED);
        assertThat(entry.expiresAt()).isEqualTo(expiresAt);
        assertThat(redisTemplate.getExpire(keyspace.blacklistedToken("jti-1"))).isBetween(1L, 600L);
    }

    @Test
    void alreadyExpiredTokenIsNotStored() {
        assertThat(tokenBlacklist.add("jti-old", RevocationReason.LOGOUT, clock.instant().minusSeconds(1))).isFalse();

        assertThat(tokenBlacklist.contains("jti-old")).isFalse();
        assertThat(redisTemplate.hasKey(keyspace.blacklistedToken("jti-old"))).isFalse();
    }

    @Test
    @DisplayName("블랙리스트 항목은 토큰 만료 시각이 지나면 스스로 사라진다")
    void entrySelfExpiresWithTheToken() throws InterruptedException {
        tokenBlacklist.add("jti-short", RevocationReason.LOGOUT, clock.instant().plusMillis(1_200));
        assertThat(tokenBlacklist.contains("jti-short")).isTrue();

        Thread.sleep(2_000);

        assertThat(tokenBlacklist.contains("jti-short")).isFalse();
        assertThat(tokenBlacklist.find("jti-short")).isEmpty();
    }

    @Test
    void eitherStructureAloneStillReportsRevocation() {
        Instant expiresAt = clock.instant().plus(Duration.ofMinutes(10));
        tokenBlacklist.add("jti-a", RevocationReason.FORCED, expiresAt);
        tokenBlacklist.add("jti-b", RevocationReason.FORCED, expiresAt);

        redisTemplate.delete(keyspace.blacklistedToken("jti-a"));
        redisTemplate.opsForZSet().remove(keyspace.blacklistGlobal(), "jti-b");

        assertThat(tokenBlacklist.contains("jti-a")).isTrue();
        assertThat(tokenBlacklist.contains("jti-b")).isTrue();
    }

    @Test
    void removeIsIdempotent() {
        tokenBlacklist.add("jti-1", RevocationReason.FORCED, clock.instant().plus(Duration.ofMinutes(10)));

        tokenBlacklist.remove("jti-1");
        tokenBlacklist.remove("jti-1");

        assertThat(tokenBlacklist.contains("jti-1")).isFalse();
        assertThat(tokenBlacklist.size()).isZero();
    }

    @Test
    void sizeCountsLiveEntriesAndGlobalKeyExpiresWithLatestMember() {
        Instant now = clock.instant();
        tokenBlacklist.add("jti-1", RevocationReason.FORCED, now.plus(Duration.ofMinutes(5)));
        tokenBlacklist.add("jti-2", RevocationReason.FORCED, now.plus(Duration.ofMinutes(30)));

        assertThat(tokenBlacklist.size()).isEqualTo(2);
        assertThat(tokenBlacklist.purgeExpired()).isZero();
        assertThat(redisTemplate.getExpire(keyspace.blacklistGlobal())).isGreaterThan(Duration.ofMinutes(25).toSeconds());
    }

    @Test
    @DisplayName("동시에 등록해도 전역 키는 가장 늦은 만료 시각까지 유지된다")
    void concurrentAddsNeverShortenGlobalExpiry() throws Exception {
        Instant now = clock.instant();
        int callers = 20;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 1; i <= callers; i++) {
                Instant expiresAt = now.plus(Duration.ofMinutes(i));
                String tokenId = "jti-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return tokenBlacklist.add(tokenId, RevocationReason.FORCED, expiresAt);
                }));
            }
            start.countDown();
            for (Future<Boolean> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(tokenBlacklist.size()).isEqualTo(callers);
        assertThat(redisTemplate.getExpire(keyspace.blacklistGlobal()))
                .isGreaterThan(Duration.ofMinutes(callers - 1).toSeconds());
    }
}
