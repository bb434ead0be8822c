package com.demo.lending.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class AssetDtos {

    private AssetDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApproveRequest {
        @NotBlank
        public String spender;
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MintRequest {
        @NotBlank
        public String to;
        @NotNull
        public BigInteger amount;
    }

    public static class BalanceView {
        public String asset;
        public String holder;
        public BigInteger balance;
        public String formatted;

        public static BalanceView of(String asset, String holder, BigInteger balance) {
            BalanceView v = new BalanceView();
            v.asset = asset; v.holder = holder; v.balance = balance;
            v.formatted = Amounts.format(balance);
            return v;
        }
    }
}
