package com.authgate.backend.modules.ratelimit.application;

import java.util.Optional;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.ratelimit.domain.KeyType;
import com.authgate.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.util.StringUtils;

/**
 * Endpoint to policy lookup and request path to endpoint routing, both read from {@link RateLimitProperties}.
 */
@Component
public class RateLimitPolicies {

    private final RateLimitProperties properties;
    private final PathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitPolicies(RateLimitProperties properties) {
        this.properties = properties;
    }

    /**
     * Unknown endpoints fall back to the default policy under their own name, so they still get a separate window.
     */
    public RateLimitPolicy resolve(KeyType keyType, String endpoint) {
        if (!StringUtils.hasText(endpoint)) {
            throw ProblemException.invalidArgument("endpoint must not be blank");
        }
        RateLimitProperties.Policy configured = properties.getPolicies().get(endpoint);
        if (configured == null) {
            configured = properties.getDefaultPolicy();
        }
        return new RateLimitPolicy(configured.getLimit(), configured.getWindow(), keyType, endpoint);
    }

    public Optional<RateLimitProperties.Route> routeFor(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return properties.getRoutes().stream()
                .filter(route -> route.getPattern() != null && pathMatcher.match(route.getPattern(), path))
                .findFirst();
    }
}
