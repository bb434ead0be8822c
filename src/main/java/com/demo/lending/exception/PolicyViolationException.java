package com.demo.lending.exception;

import lombok.Getter;

/**
 * Thrown when a protocol bound or an arithmetic precondition is breached.
 */
@Getter
public class PolicyViolationException extends LendingException {

    public enum Policy {
        INTEREST_BELOW_MINIMUM,
        LOAN_TO_COLLATERAL_ABOVE_MAXIMUM,
        DURATION_ABOVE_MAXIMUM,
        DURATION_OVERFLOW,
        ASSET_MISMATCH,
        UNKNOWN_ESCROW,
        ZERO_LOAN_TO_COLLATERAL,
        OVER_REPAYMENT,
        NEGATIVE_AMOUNT,
        UNSUPPORTED_ASSET
    }

    private final Policy policy;

    public PolicyViolationException(Policy policy, String message) {
        super(policy + ": " + message);
        this.policy = policy;
    }
}
