package com.authgate.backend.modules.ratelimit.application;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.authgate.backend.modules.ratelimit.domain.KeyType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "authgate.rate-limit")
public class RateLimitProperties {

    private Strategy strategy = Strategy.SCRIPT;

    /** Admit requests when the store is unreachable. Off unless explicitly enabled. */
    private boolean failOpen = false;

    /** WATCH/MULTI attempts before the optimistic limiter gives up. */
    private int optimisticMaxAttempts = 5;

    private Policy defaultPolicy = new Policy(100, Duration.ofMinutes(1));

    private Map<String, Policy> policies = defaultPolicies();

    /** Checked in order; the first matching pattern decides the endpoint. */
    private List<Route> routes = new ArrayList<>();

    public enum Strategy {
        SCRIPT,
        OPTIMISTIC
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        private int limit;
        private Duration window;
    }

    @Data
    public static class Route {
        private String pattern;
        private String endpoint;
        /** Empty means the authenticated user when there is one, the client IP otherwise. */
        private KeyType keyType;
    }

    private static Map<String, Policy> defaultPolicies() {
        Map<String, Policy> defaults = new LinkedHashMap<>();
        defaults.put("auth", new Policy(5, Duration.ofMinutes(1)));
        defaults.put("media_upload", new Policy(10, Duration.ofHours(1)));
        defaults.put("messaging", new Policy(60, Duration.ofMinutes(1)));
        defaults.put("matching", new Policy(100, Duration.ofHours(1)));
        defaults.put("api", new Policy(1000, Duration.ofHours(1)));
        return defaults;
    }
}
