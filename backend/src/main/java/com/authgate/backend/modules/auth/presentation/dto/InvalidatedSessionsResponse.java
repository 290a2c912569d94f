package com.authgate.backend.modules.auth.presentation.dto;

public record InvalidatedSessionsResponse(String userId, int invalidatedSessions) {
}
