package com.authgate.backend.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.session.domain.DeviceInfo;
import com.authgate.backend.modules.session.domain.Session;
import com.authgate.backend.modules.session.infrastructure.SessionRedisRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the lifecycle of session records and the per-user session index.
 * Holds no session state of its own; every read goes to the store.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final SessionRedisRepository sessionRepository;
    private final OnlineStatusBroadcaster broadcaster;
    private final Duration sessionTtl;
    private final int maxSessionsPerUser;
    private final Clock clock;

    public SessionManager(
            SessionRedisRepository sessionRepository,
            OnlineStatusBroadcaster broadcaster,
            SessionProperties properties,
            Clock clock
    ) {
        if (properties.getTtl() == null || properties.getTtl().isNegative() || properties.getTtl().isZero()) {
            throw new IllegalArgumentException("authgate.session.ttl must be positive");
        }
        if (properties.getMaxPerUser() < 1) {
            throw new IllegalArgumentException("authgate.session.max-per-user must be >= 1");
        }
        this.sessionRepository = sessionRepository;
        this.broadcaster = broadcaster;
        this.sessionTtl = properties.getTtl();
        this.maxSessionsPerUser = properties.getMaxPerUser();
        this.clock = clock;
    }

    public Session createSession(String userId, String deviceId, DeviceInfo deviceInfo, String ipAddress, String userAgent) {
        requireText(userId, "userId");
        Instant now = clock.instant();
        Session session = new Session(
                UUID.randomUUID().toString(),
                userId,
                normalizeDeviceId(deviceId),
                deviceInfo != null ? deviceInfo : DeviceInfo.unknown(),
                ipAddress,
                userAgent,
                now,
                now,
                now.plus(sessionTtl),
                true
        );

        sessionRepository.save(session, sessionTtl);
        sessionRepository.addToIndex(userId, session.id(), now.toEpochMilli(), sessionTtl);
        sessionRepository.markOnline(userId);

        evictOverflow(userId, session.id());

        log.info("Session created sessionId={} userId={} deviceId={}", session.id(), userId, session.deviceId());
        notifyOnline(userId, session.id());
        return session;
    }

    public Optional<Session> findSession(String sessionId) {
        requireText(sessionId, "sessionId");
        Optional<Session> stored = sessionRepository.findById(sessionId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Session session = stored.get();
        if (!session.isAliveAt(clock.instant())) {
            // 저장소 TTL보다 먼저 논리적으로 만료된 레코드
            log.debug("Dropping logically expired session sessionId={}", sessionId);
            removeSession(session);
            return Optional.empty();
        }
        return stored;
    }

    public Session getSession(String sessionId) {
        return findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean isSessionAlive(String sessionId) {
        return findSession(sessionId).isPresent();
    }

    /**
     * Slides the session's expiry forward. Concurrent calls race harmlessly: the last writer's timestamp wins.
     */
    public Session updateActivity(String sessionId) {
        Session current = getSession(sessionId);
        Session touched = current.touchedAt(clock.instant(), sessionTtl);
        if (!sessionRepository.saveIfPresent(touched, sessionTtl)) {
            throw new SessionNotFoundException(sessionId);
        }
        sessionRepository.extendIndex(touched.userId(), sessionTtl);
        return touched;
    }

    public void invalidateSession(String sessionId) {
        requireText(sessionId, "sessionId");
        Optional<Session> stored = sessionRepository.findById(sessionId);
        if (stored.isEmpty()) {
            log.debug("Session already gone sessionId={}", sessionId);
            return;
        }
        removeSession(stored.get());
        log.info("Session invalidated sessionId={} userId={}", sessionId, stored.get().userId());
    }

    /**
     * Deletes every session currently indexed for the user. Ids are taken from the store-side index and removed
     * one by one, so a session created concurrently for the same user stays indexed.
     *
     * @return number of session records deleted
     */
    public int invalidateAllUserSessions(String userId) {
        requireText(userId, "userId");
        List<String> sessionIds = sessionRepository.indexMembers(userId);
        int deleted = 0;
        for (String sessionId : sessionIds) {
            if (sessionRepository.delete(sessionId)) {
                deleted++;
            }
        }
        sessionRepository.removeFromIndex(userId, sessionIds);
        markOfflineIfIdle(userId);
        log.info("All sessions invalidated userId={} indexed={} deleted={}", userId, sessionIds.size(), deleted);
        return deleted;
    }

    /**
     * Live sessions of the user, newest first. Index entries whose record is gone are removed on the way.
     */
    public List<Session> getUserSessions(String userId) {
        requireText(userId, "userId");
        List<Session> sessions = loadIndexedSessions(userId);
        sessions.sort(Comparator.comparing(Session::createdAt).reversed());
        return sessions;
    }

    public boolean isUserOnline(String userId) {
        requireText(userId, "userId");
        return !loadIndexedSessions(userId).isEmpty();
    }

    /**
     * Users with at least one live session. Decided per user exactly like {@link #isUserOnline(String)}, so stale
     * index entries are dropped here as well.
     */
    public Set<String> getOnlineUsers() {
        Set<String> online = new TreeSet<>();
        for (String userId : sessionRepository.onlineUsers()) {
            if (!loadIndexedSessions(userId).isEmpty()) {
                online.add(userId);
            } else {
                sessionRepository.markOffline(userId);
            }
        }
        return online;
    }

    /**
     * Drops index and presence entries that point at sessions which no longer exist.
     * Only touches entries that are already dead, so it can run next to live traffic.
     *
     * @return number of stale index entries removed
     */
    public int reconcile() {
        int removed = 0;
        for (String userId : sessionRepository.onlineUsers()) {
            List<String> indexed = sessionRepository.indexMembers(userId);
            List<String> stale = new ArrayList<>();
            for (String sessionId : indexed) {
                if (findSession(sessionId).isEmpty()) {
                    stale.add(sessionId);
                }
            }
            sessionRepository.removeFromIndex(userId, stale);
            removed += stale.size();
            markOfflineIfIdle(userId);
        }
        return removed;
    }

    private List<Session> loadIndexedSessions(String userId) {
        List<String> indexed = sessionRepository.indexMembers(userId);
        List<Session> sessions = new ArrayList<>(indexed.size());
        List<String> stale = new ArrayList<>();
        for (String sessionId : indexed) {
            findSession(sessionId).ifPresentOrElse(sessions::add, () -> stale.add(sessionId));
        }
        if (!stale.isEmpty()) {
            log.debug("Removing stale index entries userId={} count={}", userId, stale.size());
            sessionRepository.removeFromIndex(userId, stale);
        }
        if (sessions.isEmpty() && !indexed.isEmpty()) {
            markOfflineIfIdle(userId);
        }
        return sessions;
    }

    private void evictOverflow(String userId, String keepSessionId) {
        if (sessionRepository.indexSize(userId) <= maxSessionsPerUser) {
            return;
        }
        List<Session> live = loadIndexedSessions(userId);
        int overflow = live.size() - maxSessionsPerUser;
        if (overflow <= 0) {
            return;
        }
        live.sort(Comparator.comparing(Session::createdAt));
        live.stream()
                .filter(session -> !Objects.equals(session.id(), keepSessionId))
                .limit(overflow)
                .forEach(session -> {
                    log.info("Evicting oldest session sessionId={} userId={}", session.id(), userId);
                    sessionRepository.delete(session.id());
                    sessionRepository.removeFromIndex(userId, List.of(session.id()));
                });
    }

    private void removeSession(Session session) {
        sessionRepository.delete(session.id());
        sessionRepository.removeFromIndex(session.userId(), List.of(session.id()));
        markOfflineIfIdle(session.userId());
    }

    private void markOfflineIfIdle(String userId) {
        if (sessionRepository.indexSize(userId) == 0) {
            sessionRepository.markOffline(userId);
            notifyOffline(userId);
        }
    }

    private void notifyOnline(String userId, String sessionId) {
        try {
            broadcaster.userOnline(userId, sessionId);
        } catch (RuntimeException ex) {
            log.warn("Online status broadcast failed userId={} cause={}", userId, ex.getMessage());
        }
    }

    private void notifyOffline(String userId) {
        try {
            broadcaster.userOffline(userId);
        } catch (RuntimeException ex) {
            log.warn("Offline status broadcast failed userId={} cause={}", userId, ex.getMessage());
        }
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw ProblemException.invalidArgument(name + " must not be blank");
        }
    }

    private static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
