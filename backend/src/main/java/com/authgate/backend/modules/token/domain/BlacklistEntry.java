package com.authgate.backend.modules.token.domain;

import java.time.Instant;

public record BlacklistEntry(String tokenId, String reason, Instant blacklistedAt, Instant expiresAt) {
}
