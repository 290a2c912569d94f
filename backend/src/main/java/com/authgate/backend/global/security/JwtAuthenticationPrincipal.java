package com.authgate.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(String userId, String sessionId, List<String> roles) {
}
