package com.authgate.backend.modules.session.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Server-side record of one authenticated device. Stored as JSON under {@code session:<id>}.
 */
public record Session(
        String id,
        String userId,
        String deviceId,
        DeviceInfo deviceInfo,
        String ipAddress,
        String userAgent,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        boolean active
) {

    public Session {
        if (expiresAt != null && createdAt != null && !expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
    }

    public boolean isAliveAt(Instant now) {
        return active && now.isBefore(expiresAt);
    }

    public Session touchedAt(Instant now, Duration ttl) {
        return new Session(id, userId, deviceId, deviceInfo, ipAddress, userAgent, createdAt, now, now.plus(ttl), active);
    }
}
