package com.authgate.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.presentation.dto.LoginResponse;
import com.authgate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.authgate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.authgate.backend.modules.auth.presentation.dto.SessionResponse;
import com.authgate.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.authgate.backend.modules.session.application.SessionManager;
import com.authgate.backend.modules.session.application.SessionNotFoundException;
import com.authgate.backend.modules.session.domain.Session;
import com.authgate.backend.modules.token.application.InvalidTokenException;
import com.authgate.backend.modules.token.application.SessionInactiveException;
import com.authgate.backend.modules.token.application.TokenManager;
import com.authgate.backend.modules.token.domain.RevocationReason;
import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenPair;
import com.authgate.backend.modules.token.domain.TokenType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final SessionManager sessionManager;
    private final TokenManager tokenManager;

    public AuthService(SessionManager sessionManager, TokenManager tokenManager) {
        this.sessionManager = sessionManager;
        this.tokenManager = tokenManager;
    }

    /**
     * Opens a session for a user whose credentials were already verified and issues the first token pair.
     */
    public LoginResponse startSession(StartSessionCommand command) {
        Objects.requireNonNull(command, "command");
        if (!StringUtils.hasText(command.userId())) {
            throw ProblemException.invalidArgument("userId must not be blank");
        }
        Session session = sessionManager.createSession(
                command.userId(),
                command.deviceId(),
                command.deviceInfo(),
                command.ipAddress(),
                command.userAgent()
        );
        TokenPair tokens = tokenManager.issueTokens(session, command.roles());
        return new LoginResponse(TokenPairResponse.from(tokens), SessionResponse.from(session, session.id()));
    }

    public TokenPairResponse refresh(RefreshRequest request) {
        return TokenPairResponse.from(tokenManager.rotateRefreshToken(request.refreshToken()));
    }

    /**
     * Ends the session behind a live refresh token. Unusable, already rotated or already revoked tokens change
     * nothing, and the caller cannot tell the cases apart.
     */
    public void logout(LogoutRequest request) {
        TokenClaims claims;
        try {
            claims = tokenManager.validateWithSession(request.refreshToken());
        } catch (InvalidTokenException | SessionInactiveException ex) {
            log.debug("Logout with unusable token ignored cause={}", ex.getDetailMessage());
            return;
        }
        if (claims.type() != TokenType.REFRESH) {
            return;
        }
        // 동시에 교체된 토큰이면 블랙리스트 등록에 실패하고 세션은 그대로 둔다.
        if (!tokenManager.revoke(claims, RevocationReason.LOGOUT)) {
            log.debug("Logout lost to a concurrent rotation tokenId={}", claims.tokenId());
            return;
        }
        if (claims.isBoundToSession()) {
            sessionManager.invalidateSession(claims.sessionId());
        }
    }

    public int logoutAll(String userId) {
        return tokenManager.invalidateUserTokens(userId);
    }

    public List<SessionResponse> listSessions(String userId, String currentSessionId) {
        List<SessionResponse> responses = new ArrayList<>();
        for (Session session : sessionManager.getUserSessions(userId)) {
            responses.add(SessionResponse.from(session, currentSessionId));
        }
        return responses;
    }

    /**
     * Ends one of the caller's own sessions. Someone else's session id is reported exactly like a missing one.
     */
    public void invalidateOwnSession(String userId, String sessionId) {
        Session session = sessionManager.findSession(sessionId)
                .filter(found -> found.userId().equals(userId))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        sessionManager.invalidateSession(session.id());
    }
}
