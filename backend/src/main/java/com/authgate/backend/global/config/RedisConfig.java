package com.authgate.backend.global.config;

import java.util.List;

import com.authgate.backend.global.redis.RedisKeyspace;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Store wiring. Spring Boot auto-configures the Lettuce connection factory and {@code StringRedisTemplate}
 * from {@code spring.data.redis.*}; the command timeout there is the deadline applied to every store call.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    public RedisKeyspace redisKeyspace(@Value("${authgate.redis.namespace:authgate:}") String namespace) {
        return new RedisKeyspace(namespace);
    }

    @Bean
    public RedisScript<List<Long>> slidingWindowAcquireScript() {
        return integerArrayScript("scripts/sliding_window_acquire.lua");
    }

    @Bean
    public RedisScript<List<Long>> slidingWindowStatusScript() {
        return integerArrayScript("scripts/sliding_window_status.lua");
    }

    @Bean
    public RedisScript<Long> blacklistGlobalAddScript() {
        return RedisScript.of(new ClassPathResource("scripts/blacklist_global_add.lua"), Long.class);
    }

    /**
     * Scripts replying with a flat array of integers. Lettuce decodes every element as {@link Long}.
     */
    @SuppressWarnings("unchecked")
    private static RedisScript<List<Long>> integerArrayScript(String location) {
        RedisScript<?> script = RedisScript.of(new ClassPathResource(location), List.class);
        return (RedisScript<List<Long>>) script;
    }
}
