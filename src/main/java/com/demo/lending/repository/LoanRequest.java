package com.demo.lending.repository;

import java.math.BigInteger;

/**
 * A borrower's loan offer. Amount, interest and ratio are 18-decimal fixed point,
 * duration is in seconds.
 */
public record LoanRequest(
        BigInteger amount,
        BigInteger interest,
        BigInteger loanToCollateral,
        long duration,
        boolean active
) {

    public LoanRequest deactivate() {
        return new LoanRequest(amount, interest, loanToCollateral, duration, false);
    }
}
