package com.authgate.backend.modules.token.application;

import com.authgate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidTokenException extends ProblemException {

    public InvalidTokenException(String detail) {
        super(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN", detail);
    }

    public InvalidTokenException(String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN", detail, cause);
    }
}
