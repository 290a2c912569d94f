package com.authgate.backend.modules.session.application;

/**
 * Best-effort notification hook for presence features. Failures are logged and never affect session state.
 */
public interface OnlineStatusBroadcaster {

    void userOnline(String userId, String sessionId);

    void userOffline(String userId);
}
