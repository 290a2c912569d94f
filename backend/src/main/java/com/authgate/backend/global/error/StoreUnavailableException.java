package com.authgate.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * The shared store could not be reached or did not answer within the command timeout.
 * Never translated into "allowed" or "not revoked" by library code.
 */
public class StoreUnavailableException extends RetryableProblemException {

    public static final String CODE = "STORE_UNAVAILABLE";
    private static final long RETRY_AFTER_SECONDS = 1;

    public StoreUnavailableException(String operation, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, "Store operation failed: " + operation, RETRY_AFTER_SECONDS, cause);
    }
}
