package com.authgate.backend.modules.ratelimit.presentation;

import com.authgate.backend.modules.ratelimit.application.RateLimitPolicies;
import com.authgate.backend.modules.ratelimit.application.RateLimiter;
import com.authgate.backend.modules.ratelimit.domain.KeyType;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.authgate.backend.modules.ratelimit.presentation.dto.RateLimitStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rate-limits")
@Tag(name = "Rate limit admin")
public class RateLimitAdminController {

    private final RateLimiter rateLimiter;
    private final RateLimitPolicies policies;

    public RateLimitAdminController(RateLimiter rateLimiter, RateLimitPolicies policies) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
    }

    @Operation(summary = "윈도우 상태 조회", description = "요청을 기록하지 않고 현재 남은 허용량을 반환합니다.")
    @GetMapping("/{keyType}/{endpoint}/{identifier}")
    public RateLimitStatusResponse status(
            @Parameter(description = "ip 또는 user") @PathVariable String keyType,
            @PathVariable String endpoint,
            @PathVariable String identifier
    ) {
        RateLimitPolicy policy = policies.resolve(KeyType.fromValue(keyType), endpoint);
        return RateLimitStatusResponse.from(policy, identifier, rateLimiter.status(policy, identifier));
    }

    @Operation(summary = "윈도우 초기화")
    @DeleteMapping("/{keyType}/{endpoint}/{identifier}")
    public ResponseEntity<Void> reset(
            @PathVariable String keyType,
            @PathVariable String endpoint,
            @PathVariable String identifier
    ) {
        RateLimitPolicy policy = policies.resolve(KeyType.fromValue(keyType), endpoint);
        rateLimiter.reset(policy, identifier);
        return ResponseEntity.noContent().build();
    }
}
