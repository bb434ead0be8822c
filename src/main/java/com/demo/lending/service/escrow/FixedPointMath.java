package com.demo.lending.service.escrow;

import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.PolicyViolationException.Policy;

import java.math.BigInteger;

/**
 * 18-decimal fixed-point helpers. All divisions truncate toward zero and the order of
 * operations is part of the contract: changing it changes rounding.
 */
public final class FixedPointMath {

    public static final BigInteger SCALE = BigInteger.TEN.pow(18);
    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    private static final BigInteger YEAR = BigInteger.valueOf(SECONDS_PER_YEAR);

    private FixedPointMath() {}

    /** {@code amount * SCALE / loanToCollateral} */
    public static BigInteger collateralFor(BigInteger amount, BigInteger loanToCollateral) {
        if (loanToCollateral.signum() == 0) {
            throw new PolicyViolationException(Policy.ZERO_LOAN_TO_COLLATERAL, "loan-to-collateral must be positive");
        }
        return amount.multiply(SCALE).divide(loanToCollateral);
    }

    /** {@code amount * (rate * duration / SECONDS_PER_YEAR) / SCALE} */
    public static BigInteger interestFor(BigInteger amount, BigInteger rate, long duration) {
        BigInteger periodRate = rate.multiply(BigInteger.valueOf(duration)).divide(YEAR);
        return amount.multiply(periodRate).divide(SCALE);
    }

    /** Share of {@code collateral} released by repaying {@code repaid} of {@code amount}. */
    public static BigInteger proRata(BigInteger collateral, BigInteger repaid, BigInteger amount) {
        if (repaid.equals(amount)) {
            return collateral;
        }
        return collateral.multiply(repaid).divide(amount);
    }
}
