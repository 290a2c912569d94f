package com.authgate.backend.modules.token.application;

import java.time.Instant;
import java.util.Optional;

import com.authgate.backend.modules.token.domain.BlacklistEntry;

/**
 * Revoked token identifiers, kept until the token would have expired anyway.
 */
public interface TokenBlacklist {

    /**
     * Revokes {@code tokenId} until {@code expiresAt}.
     *
     * @return {@code true} if this call created the revocation, {@code false} if the token was already revoked
     *         or has already expired
     */
    boolean add(String tokenId, String reason, Instant expiresAt);

    /**
     * Fast global-set check OR per-token record check; either one being present means revoked.
     */
    boolean contains(String tokenId);

    void remove(String tokenId);

    Optional<BlacklistEntry> find(String tokenId);

    long size();

    int purgeExpired();
}
