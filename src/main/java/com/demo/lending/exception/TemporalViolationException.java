package com.demo.lending.exception;

import lombok.Getter;

/**
 * Thrown when an operation is attempted on the wrong side of a loan's expiry.
 */
@Getter
public class TemporalViolationException extends LendingException {

    public enum Reason {
        /** The loan is past expiry; repay and roll are no longer possible. */
        DEFAULT,
        /** The loan has not expired yet; collateral cannot be seized. */
        NO_DEFAULT
    }

    private final Reason reason;

    public TemporalViolationException(Reason reason, long loanId, long expiry, long now) {
        super(String.format("%s: loan %d expiry=%d now=%d", reason, loanId, expiry, now));
        this.reason = reason;
    }
}
