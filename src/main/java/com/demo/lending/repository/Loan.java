package com.demo.lending.repository;

import java.math.BigInteger;

/**
 * An activated request. The embedded {@link LoanRequest} freezes the terms at clear time.
 */
public record Loan(
        LoanRequest request,
        BigInteger amount,
        BigInteger collateral,
        long expiry,
        boolean rollable,
        String lender
) {

    /** Past expiry; {@code now == expiry} is still current. */
    public boolean isExpired(long now) {
        return now > expiry;
    }

    public Loan withRepayment(BigInteger repaid, BigInteger released) {
        return new Loan(request, amount.subtract(repaid), collateral.subtract(released), expiry, rollable, lender);
    }

    /** Adds a term of interest and collateral; {@code newExpiry} is computed by the caller. */
    public Loan withRollover(BigInteger interest, BigInteger topUp, long newExpiry) {
        return new Loan(request, amount.add(interest), collateral.add(topUp), newExpiry, rollable, lender);
    }

    public Loan withRollable(boolean value) {
        return new Loan(request, amount, collateral, expiry, value, lender);
    }
}
