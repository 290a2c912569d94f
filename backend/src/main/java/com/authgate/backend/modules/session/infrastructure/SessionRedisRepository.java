package com.authgate.backend.modules.session.infrastructure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.global.redis.StoreCalls;
import com.authgate.backend.modules.session.domain.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis access for session records, the per-user session index and the online-users set.
 * <ul>
 *   <li>{@code session:<id>} string, JSON, TTL = remaining session lifetime</li>
 *   <li>{@code user-sessions:<userId>} sorted set of session ids scored by creation millis</li>
 *   <li>{@code online-users} set of user ids with at least one indexed session</li>
 * </ul>
 */
@Repository
public class SessionRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(SessionRedisRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisKeyspace keyspace;
    private final ObjectMapper objectMapper;

    public SessionRedisRepository(StringRedisTemplate redisTemplate, RedisKeyspace keyspace, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.keyspace = keyspace;
        this.objectMapper = objectMapper;
    }

    public void save(Session session, Duration ttl) {
        String payload = serialize(session);
        StoreCalls.run("session.save", () ->
                redisTemplate.opsForValue().set(keyspace.session(session.id()), payload, ttl));
    }

    /**
     * Overwrites the record only while it still exists so a concurrent delete is never undone.
     */
    public boolean saveIfPresent(Session session, Duration ttl) {
        String payload = serialize(session);
        Boolean written = StoreCalls.execute("session.saveIfPresent", () ->
                redisTemplate.opsForValue().setIfPresent(keyspace.session(session.id()), payload, ttl));
        return Boolean.TRUE.equals(written);
    }

    public Optional<Session> findById(String sessionId) {
        String payload = StoreCalls.execute("session.find", () ->
                redisTemplate.opsForValue().get(keyspace.session(sessionId)));
        if (payload == null) {
            return Optional.empty();
        }
        Session session = deserialize(sessionId, payload);
        if (session == null) {
            // 손상된 레코드는 지우고 없는 세션으로 취급한다.
            delete(sessionId);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public boolean delete(String sessionId) {
        return Boolean.TRUE.equals(StoreCalls.execute("session.delete", () ->
                redisTemplate.delete(keyspace.session(sessionId))));
    }

    public void addToIndex(String userId, String sessionId, long createdAtMillis, Duration ttl) {
        String indexKey = keyspace.userSessions(userId);
        StoreCalls.run("session.index.add", () -> {
            redisTemplate.opsForZSet().add(indexKey, sessionId, createdAtMillis);
            redisTemplate.expire(indexKey, ttl);
        });
    }

    public void extendIndex(String userId, Duration ttl) {
        StoreCalls.run("session.index.expire", () -> redisTemplate.expire(keyspace.userSessions(userId), ttl));
    }

    public void removeFromIndex(String userId, Collection<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return;
        }
        Object[] members = sessionIds.toArray();
        StoreCalls.run("session.index.remove", () ->
                redisTemplate.opsForZSet().remove(keyspace.userSessions(userId), members));
    }

    /**
     * Indexed session ids, oldest first.
     */
    public List<String> indexMembers(String userId) {
        Set<String> members = StoreCalls.execute("session.index.members", () ->
                redisTemplate.opsForZSet().range(keyspace.userSessions(userId), 0, -1));
        return members == null ? List.of() : new ArrayList<>(members);
    }

    public long indexSize(String userId) {
        Long size = StoreCalls.execute("session.index.size", () ->
                redisTemplate.opsForZSet().zCard(keyspace.userSessions(userId)));
        return size == null ? 0 : size;
    }

    public void markOnline(String userId) {
        StoreCalls.run("session.online.add", () -> redisTemplate.opsForSet().add(keyspace.onlineUsers(), userId));
    }

    public void markOffline(String userId) {
        StoreCalls.run("session.online.remove", () -> redisTemplate.opsForSet().remove(keyspace.onlineUsers(), userId));
    }

    public Set<String> onlineUsers() {
        Set<String> members = StoreCalls.execute("session.online.members", () ->
                redisTemplate.opsForSet().members(keyspace.onlineUsers()));
        return members == null ? Set.of() : members;
    }

    private String serialize(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize session " + session.id(), ex);
        }
    }

    private Session deserialize(String sessionId, String payload) {
        try {
            return objectMapper.readValue(payload, Session.class);
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable session record sessionId={} cause={}", sessionId, ex.getOriginalMessage());
            return null;
        }
    }
}
