package com.authgate.backend.modules.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.authgate.backend.global.redis.RedisKeyspace;
import com.authgate.backend.modules.session.application.SessionManager;
import com.authgate.backend.modules.session.application.SessionNotFoundException;
import com.authgate.backend.modules.session.domain.DeviceInfo;
import com.authgate.backend.modules.session.domain.Session;
import com.authgate.backend.support.AbstractRedisIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SessionManagerIntegrationTest extends AbstractRedisIntegrationTest {

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private RedisKeyspace keyspace;

    @Test
    void sessionRecordRoundTripsThroughStore() {
        DeviceInfo deviceInfo = new DeviceInfo("fp-1", "android", "pixel", "chrome");
        Session created = sessionManager.createSession("user-1", "device-1", deviceInfo, "10.0.0.1", "agent/1.0");

        Session loaded = sessionManager.getSession(created.id());

        assertThat(loaded).isEqualTo(created);
        assertThat(redisTemplate.getExpire(keyspace.session(created.id()))).isPositive();
        assertThat(redisTemplate.getExpire(keyspace.userSessions("user-1"))).isPositive();
        assertThat(sessionManager.isUserOnline("user-1")).isTrue();
        assertThat(sessionManager.getOnlineUsers()).contains("user-1");
    }

    @Test
    @DisplayName("세션 무효화는 여러 번 호출해도 같은 결과를 낸다")
    void invalidateSessionIsIdempotent() {
        Session session = sessionManager.createSession("user-1", null, null, null, null);

        sessionManager.invalidateSession(session.id());
        sessionManager.invalidateSession(session.id());

        assertThat(sessionManager.findSession(session.id())).isEmpty();
        assertThat(sessionManager.isUserOnline("user-1")).isFalse();
        assertThat(sessionManager.getOnlineUsers()).doesNotContain("user-1");
    }

    @Test
    @DisplayName("읽을 수 없는 세션 레코드는 삭제되고 인덱스에서도 정리된다")
    void unreadableSessionRecordIsDeleted() {
        Session session = sessionManager.createSession("user-1", null, null, null, null);
        String sessionKey = keyspace.session(session.id());
        redisTemplate.opsForValue().set(sessionKey, "{not-json");

        sessionManager.invalidateSession(session.id());

        assertThat(redisTemplate.hasKey(sessionKey)).isFalse();
        assertThat(sessionManager.getUserSessions("user-1")).isEmpty();
        assertThat(redisTemplate.opsForZSet().zCard(keyspace.userSessions("user-1"))).isZero();
        assertThat(sessionManager.getOnlineUsers()).doesNotContain("user-1");
    }

    @Test
    void invalidateAllRemovesEverySessionOfTheUserOnly() {
        sessionManager.createSession("user-1", "a", null, null, null);
        sessionManager.createSession("user-1", "b", null, null, null);
        sessionManager.createSession("user-1", "c", null, null, null);
        Session other = sessionManager.createSession("user-2", "d", null, null, null);

        int invalidated = sessionManager.invalidateAllUserSessions("user-1");

        assertThat(invalidated).isEqualTo(3);
        assertThat(sessionManager.getUserSessions("user-1")).isEmpty();
        assertThat(sessionManager.isSessionAlive(other.id())).isTrue();
        assertThat(sessionManager.getOnlineUsers()).containsExactly("user-2");
    }

    @Test
    @DisplayName("무효화된 세션은 활동 갱신으로 다시 생성되지 않는다")
    void updateActivityAfterInvalidationFails() {
        Session session = sessionManager.createSession("user-1", null, null, null, null);
        sessionManager.invalidateSession(session.id());

        assertThatThrownBy(() -> sessionManager.updateActivity(session.id())).isInstanceOf(SessionNotFoundException.class);
        assertThat(redisTemplate.hasKey(keyspace.session(session.id()))).isFalse();
    }

    @Test
    void getUserSessionsIsNewestFirst() throws InterruptedException {
        Session first = sessionManager.createSession("user-1", "a", null, null, null);
        Thread.sleep(5);
        Session second = sessionManager.createSession("user-1", "b", null, null, null);

        List<Session> sessions = sessionManager.getUserSessions("user-1");

        assertThat(sessions).extracting(Session::id).containsExactly(second.id(), first.id());
    }

    @Test
    void reconcileRemovesIndexEntriesWithoutRecords() {
        Session session = sessionManager.createSession("user-1", null, null, null, null);
        redisTemplate.delete(keyspace.session(session.id()));

        int removed = sessionManager.reconcile();

        assertThat(removed).isEqualTo(1);
        assertThat(redisTemplate.opsForZSet().zCard(keyspace.userSessions("user-1"))).isZero();
        assertThat(redisTemplate.opsForSet().isMember(keyspace.onlineUsers(), "user-1")).isFalse();
    }
}
