package com.authgate.backend.modules.auth.presentation;

import java.util.List;

import com.authgate.backend.global.security.JwtAuthenticationPrincipal;
import com.authgate.backend.global.security.SecurityUtils;
import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.authgate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.authgate.backend.modules.auth.presentation.dto.SessionResponse;
import com.authgate.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "리프레시 토큰 교체", description = "사용한 리프레시 토큰은 즉시 폐기되며 새 토큰 쌍을 반환합니다.")
    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @Operation(summary = "로그아웃")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "모든 기기에서 로그아웃")
    @PostMapping("/auth/logout-all")
    public ResponseEntity<Void> logoutAll() {
        authService.logoutAll(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "내 세션 목록", description = "최근에 생성된 세션부터 반환합니다.")
    @GetMapping("/auth/sessions")
    public List<SessionResponse> sessions() {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return authService.listSessions(principal.userId(), principal.sessionId());
    }

    @Operation(summary = "내 세션 종료")
    @DeleteMapping("/auth/sessions/{sessionId}")
    public ResponseEntity<Void> invalidateSession(@PathVariable String sessionId) {
        authService.invalidateOwnSession(SecurityUtils.getCurrentUserId(), sessionId);
        return ResponseEntity.noContent().build();
    }
}
