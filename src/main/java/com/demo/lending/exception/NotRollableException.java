package com.demo.lending.exception;

/**
 * Thrown when rolling a loan whose lender has disabled rollover
 */
public class NotRollableException extends LendingException {

    public NotRollableException(long loanId) {
        super("Loan " + loanId + " is not rollable");
    }
}
