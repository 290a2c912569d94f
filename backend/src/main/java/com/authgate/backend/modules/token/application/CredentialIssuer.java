package com.authgate.backend.modules.token.application;

import java.util.List;

import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenType;

/**
 * Signs and verifies credentials. The wire format is the issuer's concern; callers only see {@link TokenClaims}.
 */
public interface CredentialIssuer {

    TokenClaims newClaims(String userId, List<String> roles, TokenType type, String sessionId, String deviceId);

    String sign(TokenClaims claims);

    /**
     * @throws InvalidTokenException when the signature, expiry or shape of the credential is not valid
     */
    TokenClaims verify(String token);
}
