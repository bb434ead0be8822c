package com.demo.lending.service.gateway;

import com.demo.lending.exception.InvalidStateException;
import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.PolicyViolationException.Policy;
import com.demo.lending.exception.UnauthorizedException;
import com.demo.lending.repository.LoanRequest;
import com.demo.lending.service.escrow.EscrowEngine;
import com.demo.lending.service.ledger.AssetLedger;
import com.demo.lending.service.registry.EscrowRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Policy boundary for lending out of the protocol's own funds. The gateway is the lender
 * of record for every loan it clears, so repayments and seized collateral land in its
 * balance.
 *
 * <p>Roles: the operator clears requests and manages rollover; the overseer moves funds
 * in from the treasury. Both can return funds to the treasury. Each role is handed over in
 * two steps: the holder proposes a successor and the successor accepts.
 */
@Slf4j
public class RiskGateway {

    private final String address;
    private final AssetLedger collateral;
    private final AssetLedger debt;
    private final EscrowRegistry registry;
    private final Treasury treasury;
    private final GatewayPolicy policy;

    private String operator;
    private String overseer;
    private String pendingOperator;
    private String pendingOverseer;

    public RiskGateway(String address, String operator, String overseer,
                       AssetLedger collateral, AssetLedger debt,
                       EscrowRegistry registry, Treasury treasury, GatewayPolicy policy) {
        this.address = address;
        this.operator = operator;
        this.overseer = overseer;
        this.collateral = collateral;
        this.debt = debt;
        this.registry = registry;
        this.treasury = treasury;
        this.policy = policy;
    }

    /**
     * Validates the request against the protocol bounds and, if it passes, lends gateway
     * funds against it.
     *
     * @return loan id inside the escrow
     */
    public synchronized long clear(String caller, String escrowId, long reqId, long now) {
        requireOperator(caller);
        EscrowEngine escrow = genuineEscrow(escrowId);
        if (!collateral.assetId().equals(escrow.collateralAsset()) || !debt.assetId().equals(escrow.debtAsset())) {
            throw new PolicyViolationException(Policy.ASSET_MISMATCH, String.format(
                    "escrow %s pairs %s/%s, gateway lends %s/%s", escrowId,
                    escrow.collateralAsset(), escrow.debtAsset(), collateral.assetId(), debt.assetId()));
        }
        LoanRequest req = escrow.getRequest(reqId)
                .orElseThrow(() -> new InvalidStateException("Unknown request " + reqId + " on " + escrowId));
        checkTerms(req);

        BigInteger previousAllowance = debt.allowance(address, escrowId);
        debt.approve(address, escrowId, req.amount());
        long loanId;
        try {
            loanId = escrow.clear(address, reqId, now);
        } catch (RuntimeException ex) {
            debt.approve(address, escrowId, previousAllowance);
            throw ex;
        }
        log.info("Gateway cleared request {} on {} as loan {} ({} lent)", reqId, escrowId, loanId, req.amount());
        return loanId;
    }

    public synchronized boolean toggleRoll(String caller, String escrowId, long loanId) {
        requireOperator(caller);
        return genuineEscrow(escrowId).toggleRoll(address, loanId);
    }

    /** Seizes the collateral of a defaulted gateway loan into the gateway's balance. */
    public synchronized BigInteger claimDefault(String caller, String escrowId, long loanId, long now) {
        requireOperator(caller);
        BigInteger seized = genuineEscrow(escrowId).defaulted(address, loanId, now);
        log.info("Gateway seized {} collateral from loan {} on {}", seized, loanId, escrowId);
        return seized;
    }

    // ----- treasury -----

    /** Draws {@code amount} of the debt asset from the treasury into the gateway. */
    public synchronized void fund(String caller, BigInteger amount) {
        if (!caller.equals(overseer)) {
            throw new UnauthorizedException("Only the overseer can fund the gateway");
        }
        requirePositive(amount);
        treasury.fund(debt.assetId(), address, amount);
        log.info("Gateway funded with {} {}", amount, debt.assetId());
    }

    /** Returns {@code amount} of the debt or collateral asset to the treasury. */
    public synchronized void defund(String caller, String assetId, BigInteger amount) {
        if (!caller.equals(operator) && !caller.equals(overseer)) {
            throw new UnauthorizedException("Only the operator or overseer can defund the gateway");
        }
        requirePositive(amount);
        AssetLedger ledger;
        if (debt.assetId().equals(assetId)) {
            ledger = debt;
        } else if (collateral.assetId().equals(assetId)) {
            ledger = collateral;
        } else {
            throw new PolicyViolationException(Policy.ASSET_MISMATCH, "gateway holds no " + assetId);
        }
        ledger.transfer(address, treasury.address(), amount);
        log.info("Gateway returned {} {} to treasury", amount, assetId);
    }

    // ----- roles -----

    /** Nominates the next operator; {@code null} cancels a pending nomination. */
    public synchronized void proposeOperator(String caller, String candidate) {
        requireOperator(caller);
        pendingOperator = candidate;
        log.info("Operator handoff proposed: {} -> {}", operator, candidate);
    }

    public synchronized void acceptOperator(String caller) {
        if (pendingOperator == null || !pendingOperator.equals(caller)) {
            throw new UnauthorizedException("No operator handoff pending for " + caller);
        }
        log.info("Operator changed: {} -> {}", operator, caller);
        operator = caller;
        pendingOperator = null;
    }

    /** Nominates the next overseer; {@code null} cancels a pending nomination. */
    public synchronized void proposeOverseer(String caller, String candidate) {
        if (!caller.equals(overseer)) {
            throw new UnauthorizedException("Only the overseer can nominate its successor");
        }
        pendingOverseer = candidate;
        log.info("Overseer handoff proposed: {} -> {}", overseer, candidate);
    }

    public synchronized void acceptOverseer(String caller) {
        if (pendingOverseer == null || !pendingOverseer.equals(caller)) {
            throw new UnauthorizedException("No overseer handoff pending for " + caller);
        }
        log.info("Overseer changed: {} -> {}", overseer, caller);
        overseer = caller;
        pendingOverseer = null;
    }

    // ----- views -----

    public String getAddress() {
        return address;
    }

    public GatewayPolicy getPolicy() {
        return policy;
    }

    public String collateralAsset() {
        return collateral.assetId();
    }

    public String debtAsset() {
        return debt.assetId();
    }

    public synchronized String getOperator() {
        return operator;
    }

    public synchronized String getOverseer() {
        return overseer;
    }

    public synchronized String getPendingOperator() {
        return pendingOperator;
    }

    public synchronized String getPendingOverseer() {
        return pendingOverseer;
    }

    private void checkTerms(LoanRequest req) {
        log.debug("Checking terms interest={} ltc={} duration={} against {}",
                req.interest(), req.loanToCollateral(), req.duration(), policy);
        if (req.interest().compareTo(policy.minimumInterest()) < 0) {
            throw new PolicyViolationException(Policy.INTEREST_BELOW_MINIMUM,
                    "interest " + req.interest() + " < " + policy.minimumInterest());
        }
        if (req.loanToCollateral().compareTo(policy.maxLoanToCollateral()) > 0) {
            throw new PolicyViolationException(Policy.LOAN_TO_COLLATERAL_ABOVE_MAXIMUM,
                    "loan-to-collateral " + req.loanToCollateral() + " > " + policy.maxLoanToCollateral());
        }
        if (req.duration() > policy.maxDuration()) {
            throw new PolicyViolationException(Policy.DURATION_ABOVE_MAXIMUM,
                    "duration " + req.duration() + "s > " + policy.maxDuration() + "s");
        }
    }

    private EscrowEngine genuineEscrow(String escrowId) {
        if (!registry.isGenuine(escrowId)) {
            throw new PolicyViolationException(Policy.UNKNOWN_ESCROW, escrowId + " was not issued by the registry");
        }
        return registry.find(escrowId)
                .orElseThrow(() -> new PolicyViolationException(Policy.UNKNOWN_ESCROW, escrowId));
    }

    private void requireOperator(String caller) {
        if (!caller.equals(operator)) {
            throw new UnauthorizedException("Only the operator can do this");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PolicyViolationException(Policy.NEGATIVE_AMOUNT, "amount must be positive");
        }
    }
}
