package com.authgate.backend.modules.token.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenType;
import com.authgate.backend.modules.token.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * HS256 JWT implementation of {@link CredentialIssuer}.
 */
@Service
public class JwtTokenService implements CredentialIssuer {

    static final String ISSUER = "authgate";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_DEVICE_ID = "did";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${authgate.jwt.access-ttl:PT15M}") Duration accessTokenTtl,
            @Value("${authgate.jwt.refresh-ttl:P7D}") Duration refreshTokenTtl,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;
    }

    @Override
    public TokenClaims newClaims(String userId, List<String> roles, TokenType type, String sessionId, String deviceId) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        // JWT 날짜는 초 단위로 직렬화된다.
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Duration ttl = type == TokenType.ACCESS ? accessTokenTtl : refreshTokenTtl;
        return new TokenClaims(
                UUID.randomUUID().toString(),
                userId,
                roles,
                type,
                sessionId,
                deviceId,
                now,
                now.plus(ttl)
        );
    }

    @Override
    public String sign(TokenClaims claims) {
        JwtBuilder builder = Jwts.builder()
                .id(claims.tokenId())
                .issuer(ISSUER)
                .subject(claims.userId())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_TOKEN_TYPE, claims.type().claimValue())
                .claim(CLAIM_ROLES, claims.roles());
        if (claims.sessionId() != null) {
            builder.claim(CLAIM_SESSION_ID, claims.sessionId());
        }
        if (claims.deviceId() != null) {
            builder.claim(CLAIM_DEVICE_ID, claims.deviceId());
        }
        return builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
    }

    @Override
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Credential is empty");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .requireIssuer(ISSUER)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getId() == null || claims.getSubject() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException("Credential is missing required claims");
            }
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();

            return new TokenClaims(
                    claims.getId(),
                    claims.getSubject(),
                    roles,
                    TokenType.fromClaim(claims.get(CLAIM_TOKEN_TYPE, String.class)),
                    claims.get(CLAIM_SESSION_ID, String.class),
                    claims.get(CLAIM_DEVICE_ID, String.class),
                    issuedAt,
                    claims.getExpiration().toInstant()
            );
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Credential has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Credential is not valid", e);
        }
    }
}
