package com.authgate.backend.modules.session.application;

import com.authgate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class SessionNotFoundException extends ProblemException {

    public SessionNotFoundException(String sessionId) {
        super(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", "Session " + sessionId + " does not exist or has expired");
    }
}
