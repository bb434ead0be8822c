package com.demo.lending.service;

import com.demo.lending.exception.EscrowNotFoundException;
import com.demo.lending.exception.InvalidStateException;
import com.demo.lending.exception.UnauthorizedException;
import com.demo.lending.repository.Loan;
import com.demo.lending.repository.LoanRequest;
import com.demo.lending.service.escrow.EscrowEngine;
import com.demo.lending.service.gateway.RiskGateway;
import com.demo.lending.service.registry.EscrowRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point for the HTTP layer. Resolves escrows through the registry and stamps each
 * time-sensitive call with the current clock.
 */
@Service
@RequiredArgsConstructor
public class EscrowService {

    private final EscrowRegistry registry;
    private final RiskGateway gateway;
    private final Clock clock;

    public String generate(String owner, String collateralAsset, String debtAsset) {
        return registry.generate(external(owner), collateralAsset, debtAsset);
    }

    public Collection<EscrowEngine> list() {
        return registry.list();
    }

    public EscrowEngine escrow(String escrowId) {
        return registry.find(escrowId).orElseThrow(() -> new EscrowNotFoundException(escrowId));
    }

    // ----- requests -----

    public long request(String caller, String escrowId, BigInteger amount, BigInteger interest,
                        BigInteger loanToCollateral, long duration) {
        return escrow(escrowId).request(external(caller), amount, interest, loanToCollateral, duration);
    }

    public void rescind(String caller, String escrowId, long reqId) {
        escrow(escrowId).rescind(external(caller), reqId);
    }

    /** Lender fills a request directly, without the gateway's policy checks. */
    public long clear(String caller, String escrowId, long reqId) {
        return escrow(escrowId).clear(external(caller), reqId, now());
    }

    public LoanRequest getRequest(String escrowId, long reqId) {
        return escrow(escrowId).getRequest(reqId)
                .orElseThrow(() -> new InvalidStateException("Unknown request " + reqId));
    }

    public List<IndexedRequest> listRequests(String escrowId) {
        EscrowEngine escrow = escrow(escrowId);
        List<IndexedRequest> out = new ArrayList<>();
        for (long id = 0; id < escrow.requestCount(); id++) {
            long reqId = id;
            escrow.getRequest(reqId).ifPresent(r -> out.add(new IndexedRequest(reqId, r)));
        }
        return out;
    }

    // ----- loans -----

    public void repay(String caller, String escrowId, long loanId, BigInteger amount) {
        escrow(escrowId).repay(external(caller), loanId, amount, now());
    }

    public void roll(String caller, String escrowId, long loanId) {
        escrow(escrowId).roll(external(caller), loanId, now());
    }

    public boolean toggleRoll(String caller, String escrowId, long loanId) {
        return escrow(escrowId).toggleRoll(external(caller), loanId);
    }

    public BigInteger defaulted(String caller, String escrowId, long loanId) {
        return escrow(escrowId).defaulted(external(caller), loanId, now());
    }

    public Loan getLoan(String escrowId, long loanId) {
        return escrow(escrowId).getLoan(loanId)
                .orElseThrow(() -> new InvalidStateException("Loan " + loanId + " is closed or unknown"));
    }

    /** Open loans only. */
    public List<IndexedLoan> listLoans(String escrowId) {
        EscrowEngine escrow = escrow(escrowId);
        List<IndexedLoan> out = new ArrayList<>();
        for (long id = 0; id < escrow.loanCount(); id++) {
            long loanId = id;
            escrow.getLoan(loanId).ifPresent(l -> out.add(new IndexedLoan(loanId, l)));
        }
        return out;
    }

    // ----- gateway -----

    public long gatewayClear(String caller, String escrowId, long reqId) {
        return gateway.clear(external(caller), escrowId, reqId, now());
    }

    public boolean gatewayToggleRoll(String caller, String escrowId, long loanId) {
        return gateway.toggleRoll(external(caller), escrowId, loanId);
    }

    public BigInteger gatewayClaimDefault(String caller, String escrowId, long loanId) {
        return gateway.claimDefault(external(caller), escrowId, loanId, now());
    }

    /**
     * Escrow addresses hold pledged collateral and never act through the API; a caller
     * claiming one is refused.
     */
    public String external(String caller) {
        if (registry.isGenuine(caller)) {
            throw new UnauthorizedException("Escrow " + caller + " cannot act as a caller");
        }
        return caller;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    public record IndexedRequest(long id, LoanRequest request) {}

    public record IndexedLoan(long id, Loan loan) {}
}
