package com.demo.lending.exception;

/**
 * Thrown when a request or loan is in a lifecycle state that forbids the action
 * (already inactive, already closed, never existed).
 */
public class InvalidStateException extends LendingException {

    public InvalidStateException(String message) {
        super(message);
    }
}
