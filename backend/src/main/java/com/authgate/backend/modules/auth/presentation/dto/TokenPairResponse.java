package com.authgate.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.authgate.backend.modules.token.domain.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt,
        String sessionId
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(
                pair.accessToken(),
                DEFAULT_TOKEN_TYPE,
                Duration.between(pair.accessClaims().issuedAt(), pair.accessClaims().expiresAt()).toSeconds(),
                pair.refreshToken(),
                Duration.between(pair.refreshClaims().issuedAt(), pair.refreshClaims().expiresAt()).toSeconds(),
                pair.issuedAt().atOffset(ZoneOffset.UTC),
                pair.sessionId()
        );
    }
}
