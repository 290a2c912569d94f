package com.authgate.backend.modules.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.error.StoreUnavailableException;
import com.authgate.backend.modules.ratelimit.application.RateLimitExceededException;
import com.authgate.backend.modules.ratelimit.application.RateLimitGuard;
import com.authgate.backend.modules.ratelimit.application.RateLimitPolicies;
import com.authgate.backend.modules.ratelimit.application.RateLimitProperties;
import com.authgate.backend.modules.ratelimit.application.RateLimiter;
import com.authgate.backend.modules.ratelimit.domain.KeyType;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.domain.RateLimitResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class RateLimitGuardTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private RateLimiter rateLimiter;

    private RateLimitProperties properties;
    private RateLimitGuard guard;

    @BeforeEach
    void setUp() {
        properties = new RateLimitProperties();
        guard = newGuard();
    }

    @Test
    void checkIpUsesConfiguredEndpointPolicy() {
        when(rateLimiter.check(any(RateLimitPolicy.class), eq("1.2.3.4")))
                .thenAnswer(invocation -> RateLimitResult.admitted(invocation.getArgument(0), 0, NOW.toEpochMilli(), NOW.toEpochMilli()));

        RateLimitResult result = guard.checkIp("auth", "1.2.3.4");

        ArgumentCaptor<RateLimitPolicy> policy = ArgumentCaptor.forClass(RateLimitPolicy.class);
        verify(rateLimiter).check(policy.capture(), eq("1.2.3.4"));
        assertThat(policy.getValue()).isEqualTo(new RateLimitPolicy(5, Duration.ofMinutes(1), KeyType.IP, "auth"));
        assertThat(result.remaining()).isEqualTo(4);
    }

    @Test
    void unknownEndpointFallsBackToDefaultPolicy() {
        when(rateLimiter.check(any(RateLimitPolicy.class), eq("user-1")))
                .thenAnswer(invocation -> RateLimitResult.admitted(invocation.getArgument(0), 0, NOW.toEpochMilli(), NOW.toEpochMilli()));

        guard.checkUser("reports", "user-1");

        ArgumentCaptor<RateLimitPolicy> policy = ArgumentCaptor.forClass(RateLimitPolicy.class);
        verify(rateLimiter).check(policy.capture(), eq("user-1"));
        assertThat(policy.getValue()).isEqualTo(new RateLimitPolicy(100, Duration.ofMinutes(1), KeyType.USER, "reports"));
    }

    @Test
    @DisplayName("허용량을 초과하면 Retry-After 값을 담은 429 예외가 발생한다")
    void rejectionRaisesRateLimitExceeded() {
        when(rateLimiter.check(any(RateLimitPolicy.class), eq("1.2.3.4")))
                .thenAnswer(invocation -> RateLimitResult.rejected(invocation.getArgument(0), NOW.toEpochMilli(),
                        NOW.plusSeconds(3).toEpochMilli()));

        assertThatThrownBy(() -> guard.checkIp("auth", "1.2.3.4"))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(ex -> {
                    RateLimitExceededException exceeded = (RateLimitExceededException) ex;
                    assertThat(exceeded.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(exceeded.getCode()).isEqualTo("RATE_LIMITED");
                    assertThat(exceeded.getRetryAfterSeconds()).isEqualTo(57);
                });
    }

    @Test
    void storeFailurePropagatesWhenFailingClosed() {
        when(rateLimiter.check(any(RateLimitPolicy.class), eq("1.2.3.4")))
                .thenThrow(new StoreUnavailableException("ratelimit.check", new QueryTimeoutException("timeout")));

        assertThatThrownBy(() -> guard.checkIp("auth", "1.2.3.4")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void storeFailureAdmitsWhenFailOpenIsEnabled() {
        properties.setFailOpen(true);
        guard = newGuard();
        when(rateLimiter.check(any(RateLimitPolicy.class), eq("1.2.3.4")))
                .thenThrow(new StoreUnavailableException("ratelimit.check", new QueryTimeoutException("timeout")));

        RateLimitResult result = guard.checkIp("auth", "1.2.3.4");

        assertThat(result.allowed()).isTrue();
        assertThat(result.remaining()).isEqualTo(5);
    }

    @Test
    void blankIdentifierIsRejectedBeforeTheStore() {
        assertThatThrownBy(() -> guard.checkUser("auth", ""))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("INVALID_ARGUMENT"));
        verifyNoInteractions(rateLimiter);
    }

    private RateLimitGuard newGuard() {
        return new RateLimitGuard(rateLimiter, new RateLimitPolicies(properties), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
