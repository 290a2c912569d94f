package com.authgate.backend.modules.auth.presentation;

import java.util.ArrayList;

import com.authgate.backend.modules.auth.presentation.dto.InvalidatedSessionsResponse;
import com.authgate.backend.modules.auth.presentation.dto.OnlineUsersResponse;
import com.authgate.backend.modules.session.application.SessionManager;
import com.authgate.backend.modules.token.application.TokenManager;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
@Tag(name = "Session admin")
public class AdminSessionController {

    private final TokenManager tokenManager;
    private final SessionManager sessionManager;

    public AdminSessionController(TokenManager tokenManager, SessionManager sessionManager) {
        this.tokenManager = tokenManager;
        this.sessionManager = sessionManager;
    }

    @Operation(summary = "사용자 강제 로그아웃", description = "사용자의 모든 세션을 종료해 해당 세션에 묶인 토큰을 모두 무효화합니다.")
    @DeleteMapping("/{userId}/sessions")
    public InvalidatedSessionsResponse invalidateUserSessions(@PathVariable String userId) {
        return new InvalidatedSessionsResponse(userId, tokenManager.invalidateUserTokens(userId));
    }

    @Operation(summary = "접속 중인 사용자")
    @GetMapping("/online")
    public OnlineUsersResponse onlineUsers() {
        return OnlineUsersResponse.of(new ArrayList<>(sessionManager.getOnlineUsers()));
    }
}
