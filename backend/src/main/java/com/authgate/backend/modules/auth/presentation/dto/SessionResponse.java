package com.authgate.backend.modules.auth.presentation.dto;

import java.time.Instant;

import com.authgate.backend.modules.session.domain.Session;

public record SessionResponse(
        String sessionId,
        String deviceId,
        String platform,
        String device,
        String browser,
        String ipAddress,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        boolean current
) {

    public static SessionResponse from(Session session, String currentSessionId) {
        return new SessionResponse(
                session.id(),
                session.deviceId(),
                session.deviceInfo().platform(),
                session.deviceInfo().device(),
                session.deviceInfo().browser(),
                session.ipAddress(),
                session.createdAt(),
                session.lastActivityAt(),
                session.expiresAt(),
                session.id().equals(currentSessionId)
        );
    }
}
