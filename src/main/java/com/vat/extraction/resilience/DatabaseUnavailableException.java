package com.vat.extraction.resilience;

/**
 * The database operation still failed after the configured retries.
 */
public class DatabaseUnavailableException extends RuntimeException {

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
