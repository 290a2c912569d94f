package com.authgate.backend.modules.session.infrastructure;

import com.authgate.backend.modules.session.application.OnlineStatusBroadcaster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingOnlineStatusBroadcaster implements OnlineStatusBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(LoggingOnlineStatusBroadcaster.class);

    @Override
    public void userOnline(String userId, String sessionId) {
        log.info("User online userId={} sessionId={}", userId, sessionId);
    }

    @Override
    public void userOffline(String userId) {
        log.info("User offline userId={}", userId);
    }
}
