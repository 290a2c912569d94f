package com.authgate.backend.modules.token.domain;

import java.time.Instant;

public record TokenPair(
        String accessToken,
        TokenClaims accessClaims,
        String refreshToken,
        TokenClaims refreshClaims
) {

    public String sessionId() {
        return refreshClaims.sessionId();
    }

    public Instant issuedAt() {
        return refreshClaims.issuedAt();
    }
}
