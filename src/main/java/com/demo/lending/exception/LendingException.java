package com.demo.lending.exception;

/**
 * Base exception for the lending protocol. Every rejection aborts the whole operation.
 */
public class LendingException extends RuntimeException {

    public LendingException(String message) {
        super(message);
    }

    public LendingException(String message, Throwable cause) {
        super(message, cause);
    }
}
