package com.vat.extraction.exception;

/**
 * Request is well-formed but missing something the operation needs.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
