package com.authgate.backend.global.redis;

import java.util.function.Supplier;

import com.authgate.backend.global.error.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Runs a store command and turns Spring's {@link DataAccessException} family
 * (connection failures, command timeouts, script errors) into {@link StoreUnavailableException}.
 */
public final class StoreCalls {

    private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);

    private StoreCalls() {
    }

    public static <T> T execute(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException ex) {
            log.error("Store command failed operation={} cause={}", operation, ex.getMessage());
            throw new StoreUnavailableException(operation, ex);
        }
    }

    public static void run(String operation, Runnable command) {
        execute(operation, () -> {
            command.run();
            return null;
        });
    }
}
