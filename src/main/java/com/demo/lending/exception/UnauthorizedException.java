package com.demo.lending.exception;

/**
 * Thrown when the caller is not the identity an operation requires
 */
public class UnauthorizedException extends LendingException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
