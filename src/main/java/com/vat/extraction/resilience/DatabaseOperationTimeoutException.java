package com.vat.extraction.resilience;

import java.time.Duration;

/**
 * A single database attempt exceeded its deadline. Counted as a failure by the breaker.
 */
public class DatabaseOperationTimeoutException extends RuntimeException {

    public DatabaseOperationTimeoutException(String operationName, Duration timeout) {
        super("Database operation '" + operationName + "' timed out after " + timeout.toMillis() + "ms");
    }
}
