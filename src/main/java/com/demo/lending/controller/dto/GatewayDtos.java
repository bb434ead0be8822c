package com.demo.lending.controller.dto;

import com.demo.lending.service.gateway.RiskGateway;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class GatewayDtos {

    private GatewayDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClearRequest {
        @NotBlank
        public String escrow;
        @NotNull
        public Long requestId;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoanRef {
        @NotBlank
        public String escrow;
        @NotNull
        public Long loanId;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FundRequest {
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DefundRequest {
        @NotBlank
        public String asset;
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoleProposal {
        public String candidate;  // null cancels
    }

    public static class GatewayView {
        public String address;
        public String operator;
        public String overseer;
        public String pendingOperator;
        public String pendingOverseer;
        public String collateralAsset;
        public String debtAsset;
        public BigInteger minimumInterest;
        public BigInteger maxLoanToCollateral;
        public long maxDuration;

        public static GatewayView from(RiskGateway g) {
            GatewayView v = new GatewayView();
            v.address = g.getAddress();
            v.operator = g.getOperator(); v.overseer = g.getOverseer();
            v.pendingOperator = g.getPendingOperator(); v.pendingOverseer = g.getPendingOverseer();
            v.collateralAsset = g.collateralAsset(); v.debtAsset = g.debtAsset();
            v.minimumInterest = g.getPolicy().minimumInterest();
            v.maxLoanToCollateral = g.getPolicy().maxLoanToCollateral();
            v.maxDuration = g.getPolicy().maxDuration();
            return v;
        }
    }
}
