package com.authgate.backend.modules.session.application;

import com.authgate.backend.modules.token.application.TokenBlacklist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional sweep of index and blacklist entries that are already dead. Correctness never depends on it;
 * all records expire through store TTL on their own.
 */
@Component
@ConditionalOnProperty(value = "authgate.reconciliation.enabled", havingValue = "true")
public class SessionReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionReconciliationScheduler.class);

    private final SessionManager sessionManager;
    private final TokenBlacklist tokenBlacklist;

    public SessionReconciliationScheduler(SessionManager sessionManager, TokenBlacklist tokenBlacklist) {
        this.sessionManager = sessionManager;
        this.tokenBlacklist = tokenBlacklist;
    }

    @Scheduled(fixedDelayString = "${authgate.reconciliation.interval:PT10M}")
    public void reconcile() {
        try {
            int staleSessions = sessionManager.reconcile();
            int expiredTokens = tokenBlacklist.purgeExpired();
            if (staleSessions > 0 || expiredTokens > 0) {
                log.info("Reconciliation removed staleIndexEntries={} expiredBlacklistEntries={}", staleSessions, expiredTokens);
            }
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Reconciliation] pass aborted detail={}", ex.getMessage(), ex);
        }
    }
}
