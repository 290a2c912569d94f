package com.authgate.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock shared by session, blacklist and rate-limit code so tests can pin time.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock systemUtcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
