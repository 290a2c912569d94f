package com.authgate.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정 검증. 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    static final String DEV_JWT_SECRET = "dev-authgate-jwt-secret-change-in-production-2025";

    private static final String[] REQUIRED_KEYS = {
            "authgate.jwt.secret",
            "spring.data.redis.host",
            "spring.data.redis.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": 필수 값이 없습니다");
            }
        }

        // 운영 프로필에서 기본 시크릿 사용 금지
        boolean production = Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> profile.equalsIgnoreCase("prod") || profile.equalsIgnoreCase("production"));
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("authgate.jwt.secret"));
        if (jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            if (production) {
                problems.add("authgate.jwt.secret: 기본값을 실제 랜덤 문자열로 변경하세요");
            } else {
                log.warn("authgate.jwt.secret is the development default");
            }
        }

        requirePositiveDuration("authgate.jwt.access-ttl", problems);
        requirePositiveDuration("authgate.jwt.refresh-ttl", problems);
        requirePositiveDuration("authgate.session.ttl", problems);
        requirePositiveDuration("spring.data.redis.timeout", problems);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    private void requirePositiveDuration(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            Duration duration = DurationStyle.detectAndParse(raw.trim());
            if (duration.isNegative() || duration.isZero()) {
                problems.add(key + ": 0보다 커야 합니다");
            }
        } catch (IllegalArgumentException ex) {
            problems.add(key + ": 기간 형식이 아닙니다 (" + raw + ")");
        }
    }
}
