package com.authgate.backend.modules.token.application;

import java.util.List;
import java.util.Objects;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.session.application.SessionManager;
import com.authgate.backend.modules.session.application.SessionNotFoundException;
import com.authgate.backend.modules.session.domain.Session;
import com.authgate.backend.modules.token.domain.RevocationReason;
import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenPair;
import com.authgate.backend.modules.token.domain.TokenType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Couples credentials to sessions. A token bound to a session is only as valid as that session;
 * revoking a single token goes through the {@link TokenBlacklist}.
 */
@Service
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final CredentialIssuer credentialIssuer;
    private final TokenBlacklist tokenBlacklist;
    private final SessionManager sessionManager;

    public TokenManager(CredentialIssuer credentialIssuer, TokenBlacklist tokenBlacklist, SessionManager sessionManager) {
        this.credentialIssuer = credentialIssuer;
        this.tokenBlacklist = tokenBlacklist;
        this.sessionManager = sessionManager;
    }

    public TokenPair issueTokens(Session session, List<String> roles) {
        Objects.requireNonNull(session, "session");
        return mint(session.userId(), roles, session.id(), session.deviceId());
    }

    /**
     * Exchanges a refresh token for a new pair. The old token id is blacklisted before anything is minted, and only
     * the caller whose blacklist write created the entry gets new tokens, so each refresh token is usable once.
     */
    public TokenPair rotateRefreshToken(String refreshToken) {
        TokenClaims claims = credentialIssuer.verify(refreshToken);
        if (claims.type() != TokenType.REFRESH) {
            throw new InvalidTokenException("Credential is not a refresh token");
        }
        if (tokenBlacklist.contains(claims.tokenId())) {
            log.warn("Rotation attempted with revoked refresh token tokenId={} userId={}", claims.tokenId(), claims.userId());
            throw new InvalidTokenException("Refresh token has been revoked");
        }
        if (!claims.isBoundToSession() || !sessionManager.isSessionAlive(claims.sessionId())) {
            throw new SessionInactiveException(claims.sessionId());
        }

        // 블랙리스트 등록에 성공한 요청만 새 토큰을 받는다.
        if (!tokenBlacklist.add(claims.tokenId(), RevocationReason.ROTATED, claims.expiresAt())) {
            log.warn("Concurrent rotation lost tokenId={} userId={}", claims.tokenId(), claims.userId());
            throw new InvalidTokenException("Refresh token has already been used");
        }

        Session touched;
        try {
            touched = sessionManager.updateActivity(claims.sessionId());
        } catch (SessionNotFoundException ex) {
            throw new SessionInactiveException(claims.sessionId());
        }

        TokenPair pair = mint(claims.userId(), claims.roles(), touched.id(), touched.deviceId());
        log.info("Refresh token rotated userId={} sessionId={} oldTokenId={} newTokenId={}",
                claims.userId(), touched.id(), claims.tokenId(), pair.refreshClaims().tokenId());
        return pair;
    }

    public TokenClaims validateWithSession(String credential) {
        TokenClaims claims = credentialIssuer.verify(credential);
        if (tokenBlacklist.contains(claims.tokenId())) {
            throw new InvalidTokenException("Credential has been revoked");
        }
        if (claims.isBoundToSession() && !sessionManager.isSessionAlive(claims.sessionId())) {
            throw new SessionInactiveException(claims.sessionId());
        }
        return claims;
    }

    /**
     * Blacklists one credential for the rest of its validity.
     *
     * @return the verified claims of the revoked credential
     */
    public TokenClaims revoke(String credential, String reason) {
        TokenClaims claims = credentialIssuer.verify(credential);
        revoke(claims, reason);
        return claims;
    }

    /**
     * Blacklists already verified claims.
     *
     * @return {@code true} only for the caller whose write created the blacklist entry
     */
    public boolean revoke(TokenClaims claims, String reason) {
        Objects.requireNonNull(claims, "claims");
        String effectiveReason = StringUtils.hasText(reason) ? reason : RevocationReason.FORCED;
        if (!tokenBlacklist.add(claims.tokenId(), effectiveReason, claims.expiresAt())) {
            return false;
        }
        log.info("Credential revoked tokenId={} userId={} reason={}", claims.tokenId(), claims.userId(), effectiveReason);
        return true;
    }

    /**
     * Every token bound to one of the user's sessions fails validation once this returns.
     */
    public int invalidateUserTokens(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ProblemException.invalidArgument("userId must not be blank");
        }
        int invalidated = sessionManager.invalidateAllUserSessions(userId);
        log.info("User tokens invalidated userId={} sessions={}", userId, invalidated);
        return invalidated;
    }

    private TokenPair mint(String userId, List<String> roles, String sessionId, String deviceId) {
        TokenClaims accessClaims = credentialIssuer.newClaims(userId, roles, TokenType.ACCESS, sessionId, deviceId);
        TokenClaims refreshClaims = credentialIssuer.newClaims(userId, roles, TokenType.REFRESH, sessionId, deviceId);
        return new TokenPair(
                credentialIssuer.sign(accessClaims),
                accessClaims,
                credentialIssuer.sign(refreshClaims),
                refreshClaims
        );
    }
}
