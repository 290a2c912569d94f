package com.authgate.backend.modules.token.domain;

import java.time.Instant;
import java.util.List;

/**
 * Claims carried by an access or refresh credential. {@code tokenId} is the identifier recorded in the blacklist;
 * {@code sessionId} couples the credential's validity to that session's liveness.
 */
public record TokenClaims(
        String tokenId,
        String userId,
        List<String> roles,
        TokenType type,
        String sessionId,
        String deviceId,
        Instant issuedAt,
        Instant expiresAt
) {

    public TokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isBoundToSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
