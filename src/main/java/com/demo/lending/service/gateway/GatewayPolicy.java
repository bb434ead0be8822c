package com.demo.lending.service.gateway;

import java.math.BigInteger;

/**
 * Protocol-wide bounds a request must satisfy before the gateway lends against it.
 *
 * @param minimumInterest     lowest annual rate accepted, 1e18 == 100%
 * @param maxLoanToCollateral highest debt per collateral unit accepted, 18 decimals
 * @param maxDuration         longest tenor accepted, seconds
 */
public record GatewayPolicy(BigInteger minimumInterest, BigInteger maxLoanToCollateral, long maxDuration) {}
