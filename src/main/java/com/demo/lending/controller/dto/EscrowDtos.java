package com.demo.lending.controller.dto;

import com.demo.lending.repository.Loan;
import com.demo.lending.repository.LoanRequest;
import com.demo.lending.service.escrow.EscrowEngine;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.Instant;

import static com.demo.lending.service.escrow.FixedPointMath.collateralFor;

public final class EscrowDtos {

    private EscrowDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateRequest {
        @NotBlank
        public String collateralAsset;
        @NotBlank
        public String debtAsset;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RequestTerms {
        @NotNull
        public BigInteger amount;
        @NotNull
        public BigInteger interest;          // 1e18 == 100% a year
        @NotNull
        public BigInteger loanToCollateral;  // debt units per collateral unit, 18 decimals
        @PositiveOrZero
        public long duration;                // seconds
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RepayRequest {
        @NotNull
        public BigInteger amount;
    }

    // -------- Responses ----------
    public static class EscrowView {
        public String address;
        public String owner;
        public String collateralAsset;
        public String debtAsset;
        public long requestCount;
        public long loanCount;

        public static EscrowView from(EscrowEngine e) {
            EscrowView v = new EscrowView();
            v.address = e.getAddress(); v.owner = e.getOwner();
            v.collateralAsset = e.collateralAsset(); v.debtAsset = e.debtAsset();
            v.requestCount = e.requestCount(); v.loanCount = e.loanCount();
            return v;
        }
    }

    public static class CreatedResponse {
        public String escrow;
        public long id;

        public static CreatedResponse of(String escrow, long id) {
            CreatedResponse r = new CreatedResponse();
            r.escrow = escrow; r.id = id;
            return r;
        }
    }

    public static class RequestView {
        public Long id;                   // null when embedded in a loan
        public BigInteger amount;
        public BigInteger interest;
        public BigInteger loanToCollateral;
        public long duration;
        public boolean active;
        public BigInteger collateral;     // locked while active
        public String amountFormatted;

        public static RequestView from(Long id, LoanRequest r) {
            RequestView v = new RequestView();
            v.id = id;
            v.amount = r.amount(); v.interest = r.interest();
            v.loanToCollateral = r.loanToCollateral(); v.duration = r.duration();
            v.active = r.active();
            v.collateral = collateralFor(r.amount(), r.loanToCollateral());
            v.amountFormatted = Amounts.format(r.amount());
            return v;
        }
    }

    public static class LoanView {
        public long id;
        public BigInteger amount;
        public BigInteger collateral;
        public long expiry;
        public Instant expiresAt;
        public boolean rollable;
        public String lender;
        public String amountFormatted;
        public String collateralFormatted;
        public RequestView request;

        public static LoanView from(long id, Loan l) {
            LoanView v = new LoanView();
            v.id = id;
            v.amount = l.amount(); v.collateral = l.collateral();
            v.expiry = l.expiry(); v.expiresAt = Instant.ofEpochSecond(l.expiry());
            v.rollable = l.rollable(); v.lender = l.lender();
            v.amountFormatted = Amounts.format(l.amount());
            v.collateralFormatted = Amounts.format(l.collateral());
            v.request = RequestView.from(null, l.request());
            return v;
        }
    }

    public static class RollableResponse {
        public boolean rollable;
    }

    public static class SeizedResponse {
        public BigInteger seized;
    }
}
