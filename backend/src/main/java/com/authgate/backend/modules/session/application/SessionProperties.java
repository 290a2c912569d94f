package com.authgate.backend.modules.session.application;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "authgate.session")
public class SessionProperties {

    /** Lifetime of a session record; slides forward on every refresh. */
    private Duration ttl = Duration.ofDays(7);

    /** Live sessions kept per user before the oldest are evicted. */
    private int maxPerUser = 10;
}
