package com.demo.lending.controller.dto;

import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Human-readable rendering of 18-decimal base units. */
public final class Amounts {

    private Amounts() {}

    public static String format(BigInteger units) {
        return Convert.fromWei(new BigDecimal(units), Convert.Unit.ETHER).stripTrailingZeros().toPlainString();
    }
}
