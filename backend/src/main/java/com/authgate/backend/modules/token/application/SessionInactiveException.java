package com.authgate.backend.modules.token.application;

import com.authgate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * The credential itself is valid but the session it is bound to is gone or expired.
 */
public class SessionInactiveException extends ProblemException {

    public SessionInactiveException(String sessionId) {
        super(HttpStatus.UNAUTHORIZED, "SESSION_INACTIVE", "Session " + sessionId + " is inactive or expired");
    }
}
