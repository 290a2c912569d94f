package com.authgate.backend.global.redis;

import java.util.Objects;

/**
 * Key layout shared by every component that writes to the store.
 * Each component owns one prefix below the namespace so nothing collides when several services share one Redis.
 */
public final class RedisKeyspace {

    private static final String SESSION = "session:";
    private static final String USER_SESSIONS = "user-sessions:";
    private static final String ONLINE_USERS = "online-users";
    private static final String BLACKLIST_TOKEN = "blacklist:token:";
    private static final String BLACKLIST_GLOBAL = "blacklist:global";
    private static final String RATE = "rate:";

    private final String namespace;

    public RedisKeyspace(String namespace) {
        this.namespace = Objects.requireNonNullElse(namespace, "");
    }

    public String session(String sessionId) {
        return namespace + SESSION + sessionId;
    }

    public String userSessions(String userId) {
        return namespace + USER_SESSIONS + userId;
    }

    public String onlineUsers() {
        return namespace + ONLINE_USERS;
    }

    public String blacklistedToken(String tokenId) {
        return namespace + BLACKLIST_TOKEN + tokenId;
    }

    public String blacklistGlobal() {
        return namespace + BLACKLIST_GLOBAL;
    }

    public String rateLimit(String keyType, String endpoint, String identifier) {
        return namespace + RATE + keyType + ":" + endpoint + ":" + identifier;
    }
}
