package com.authgate.backend.modules.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.authgate.backend.global.error.StoreUnavailableException;
import com.authgate.backend.modules.session.application.SessionManager;
import com.authgate.backend.modules.session.domain.DeviceInfo;
import com.authgate.backend.modules.session.domain.Session;
import com.authgate.backend.modules.token.application.CredentialIssuer;
import com.authgate.backend.modules.token.application.InvalidTokenException;
import com.authgate.backend.modules.token.application.SessionInactiveException;
import com.authgate.backend.modules.token.application.TokenBlacklist;
import com.authgate.backend.modules.token.application.TokenManager;
import com.authgate.backend.modules.token.domain.RevocationReason;
import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenPair;
import com.authgate.backend.modules.token.domain.TokenType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class TokenManagerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final List<String> ROLES = List.of("USER");

    @Mock
    private CredentialIssuer credentialIssuer;

    @Mock
    private TokenBlacklist tokenBlacklist;

    @Mock
    private SessionManager sessionManager;

    private TokenManager tokenManager;

    private TokenClaims oldRefresh;

    @BeforeEach
    void setUp() {
        tokenManager = new TokenManager(credentialIssuer, tokenBlacklist, sessionManager);
        oldRefresh = claims("old-jti", TokenType.REFRESH, "session-1");
    }

    @Test
    @DisplayName("리프레시 토큰 교체는 기존 토큰을 먼저 폐기한 뒤 새 토큰을 발급한다")
    void rotateBlacklistsOldTokenBeforeMinting() {
        when(credentialIssuer.verify("old-refresh")).thenReturn(oldRefresh);
        when(tokenBlacklist.contains("old-jti")).thenReturn(false);
        when(sessionManager.isSessionAlive("session-1")).thenReturn(true);
        when(tokenBlacklist.add("old-jti", RevocationReason.ROTATED, oldRefresh.expiresAt())).thenReturn(true);
        when(sessionManager.updateActivity("session-1")).thenReturn(session("session-1"));
        stubMinting();

        TokenPair pair = tokenManager.rotateRefreshToken("old-refresh");

        assertThat(pair.accessToken()).isEqualTo("signed-access");
        assertThat(pair.refreshToken()).isEqualTo("signed-refresh");
        assertThat(pair.sessionId()).isEqualTo("session-1");
        InOrder order = inOrder(tokenBlacklist, sessionManager, credentialIssuer);
        order.verify(tokenBlacklist).add("old-jti", RevocationReason.ROTATED, oldRefresh.expiresAt());
        order.verify(sessionManager).updateActivity("session-1");
        order.verify(credentialIssuer, times(2)).sign(any(TokenClaims.class));
    }

    @Test
    void rotateRejectsAccessToken() {
        when(credentialIssuer.verify("access")).thenReturn(claims("a-jti", TokenType.ACCESS, "session-1"));

        assertThatThrownBy(() -> tokenManager.rotateRefreshToken("access")).isInstanceOf(InvalidTokenException.class);
        verify(tokenBlacklist, never()).add(anyString(), anyString(), any(Instant.class));
    }

    @Test
    void rotateRejectsBlacklistedToken() {
        when(credentialIssuer.verify("old-refresh")).thenReturn(oldRefresh);
        when(tokenBlacklist.contains("old-jti")).thenReturn(true);

        assertThatThrownBy(() -> tokenManager.rotateRefreshToken("old-refresh")).isInstanceOf(InvalidTokenException.class);
        verify(sessionManager, never()).isSessionAlive(anyString());
        verify(credentialIssuer, never()).sign(any(TokenClaims.class));
    }

    @Test
    void rotateRequiresLiveSession() {
        when(credentialIssuer.verify("old-refresh")).thenReturn(oldRefresh);
        when(tokenBlacklist.contains("old-jti")).thenReturn(false);
        when(sessionManager.isSessionAlive("session-1")).thenReturn(false);

        assertThatThrownBy(() -> tokenManager.rotateRefreshToken("old-refresh")).isInstanceOf(SessionInactiveException.class);
        verify(tokenBlacklist, never()).add(anyString(), anyString(), any(Instant.class));
    }

    @Test
    @DisplayName("동시 교체에서 블랙리스트 등록에 실패한 쪽은 새 토큰을 받지 못한다")
    void rotateFailsWhenAnotherCallerWonTheBlacklistWrite() {
        when(credentialIssuer.verify("old-refresh")).thenReturn(oldRefresh);
        when(tokenBlacklist.contains("old-jti")).thenReturn(false);
        when(sessionManager.isSessionAlive("session-1")).thenReturn(true);
        when(tokenBlacklist.add("old-jti", RevocationReason.ROTATED, oldRefresh.expiresAt())).thenReturn(false);

        assertThatThrownBy(() -> tokenManager.rotateRefreshToken("old-refresh")).isInstanceOf(InvalidTokenException.class);
        verify(sessionManager, never()).updateActivity(anyString());
        verify(credentialIssuer, never()).sign(any(TokenClaims.class));
    }

    @Test
    void rotateFailsClosedWhenStoreIsDown() {
        when(credentialIssuer.verify("old-refresh")).thenReturn(oldRefresh);
        when(tokenBlacklist.contains("old-jti")).thenReturn(false);
        when(sessionManager.isSessionAlive("session-1")).thenReturn(true);
        when(tokenBlacklist.add(eq("old-jti"), anyString(), any(Instant.class)))
                .thenThrow(new StoreUnavailableException("blacklist.add", new QueryTimeoutException("timeout")));

        assertThatThrownBy(() -> tokenManager.rotateRefreshToken("old-refresh")).isInstanceOf(StoreUnavailableException.class);
        verify(credentialIssuer, never()).sign(any(TokenClaims.class));
    }

    @Test
    void validateRejectsRevokedCredential() {
        when(credentialIssuer.verify("access")).thenReturn(claims("a-jti", TokenType.ACCESS, "session-1"));
        when(tokenBlacklist.contains("a-jti")).thenReturn(true);

        assertThatThrownBy(() -> tokenManager.validateWithSession("access")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("세션이 종료되면 그 세션에 묶인 토큰도 더 이상 유효하지 않다")
    void validateRejectsTokenOfDeadSession() {
        when(credentialIssuer.verify("access")).thenReturn(claims("a-jti", TokenType.ACCESS, "session-1"));
        when(tokenBlacklist.contains("a-jti")).thenReturn(false);
        when(sessionManager.isSessionAlive("session-1")).thenReturn(false);

        assertThatThrownBy(() -> tokenManager.validateWithSession("access")).isInstanceOf(SessionInactiveException.class);
    }

    @Test
    void validateSkipsSessionCheckForUnboundToken() {
        TokenClaims unbound = claims("a-jti", TokenType.ACCESS, null);
        when(credentialIssuer.verify("access")).thenReturn(unbound);
        when(tokenBlacklist.contains("a-jti")).thenReturn(false);

        assertThat(tokenManager.validateWithSession("access")).isEqualTo(unbound);
        verify(sessionManager, never()).isSessionAlive(anyString());
    }

    @Test
    void revokeBlacklistsUntilNaturalExpiry() {
        TokenClaims access = claims("a-jti", TokenType.ACCESS, "session-1");
        when(credentialIssuer.verify("access")).thenReturn(access);
        when(tokenBlacklist.add("a-jti", RevocationReason.LOGOUT, access.expiresAt())).thenReturn(true);

        assertThat(tokenManager.revoke("access", RevocationReason.LOGOUT)).isEqualTo(access);
    }

    @Test
    void invalidateUserTokensDelegatesToSessionInvalidation() {
        when(sessionManager.invalidateAllUserSessions("user-1")).thenReturn(3);

        assertThat(tokenManager.invalidateUserTokens("user-1")).isEqualTo(3);
    }

    private void stubMinting() {
        TokenClaims newAccess = claims("new-access-jti", TokenType.ACCESS, "session-1");
        TokenClaims newRefresh = claims("new-refresh-jti", TokenType.REFRESH, "session-1");
        when(credentialIssuer.newClaims("user-1", ROLES, TokenType.ACCESS, "session-1", "device-1")).thenReturn(newAccess);
        when(credentialIssuer.newClaims("user-1", ROLES, TokenType.REFRESH, "session-1", "device-1")).thenReturn(newRefresh);
        when(credentialIssuer.sign(newAccess)).thenReturn("signed-access");
        when(credentialIssuer.sign(newRefresh)).thenReturn("signed-refresh");
    }

    private static TokenClaims claims(String tokenId, TokenType type, String sessionId) {
        Duration ttl = type == TokenType.ACCESS ? Duration.ofMinutes(15) : Duration.ofDays(7);
        return new TokenClaims(tokenId, "user-1", ROLES, type, sessionId, "device-1", NOW, NOW.plus(ttl));
    }

    private static Session session(String id) {
        return new Session(id, "user-1", "device-1", DeviceInfo.unknown(), null, null,
                NOW.minus(Duration.ofHours(1)), NOW, NOW.plus(Duration.ofDays(7)), true);
    }
}
