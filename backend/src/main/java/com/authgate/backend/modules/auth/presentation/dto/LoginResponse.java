package com.authgate.backend.modules.auth.presentation.dto;

public record LoginResponse(TokenPairResponse tokens, SessionResponse session) {
}
