package com.demo.lending.service.escrow;

import com.demo.lending.exception.InvalidStateException;
import com.demo.lending.exception.LedgerTransferException;
import com.demo.lending.exception.NotRollableException;
import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.PolicyViolationException.Policy;
import com.demo.lending.exception.TemporalViolationException;
import com.demo.lending.exception.TemporalViolationException.Reason;
import com.demo.lending.exception.UnauthorizedException;
import com.demo.lending.repository.AppendOnlyBook;
import com.demo.lending.repository.Loan;
import com.demo.lending.repository.LoanRequest;
import com.demo.lending.service.events.EscrowEvent;
import com.demo.lending.service.events.EscrowEventSink;
import com.demo.lending.service.ledger.AssetLedger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Optional;

import static com.demo.lending.service.escrow.FixedPointMath.collateralFor;
import static com.demo.lending.service.escrow.FixedPointMath.interestFor;
import static com.demo.lending.service.escrow.FixedPointMath.proRata;

/**
 * Escrow for one borrower and one (collateral, debt) asset pair. Holds the borrower's
 * requests and the loans cleared against them.
 *
 * <p>Every public operation runs under the instance monitor. State is mutated before the
 * ledger call it triggers, so a caller that re-enters during a transfer already sees the
 * new state; if the ledger call throws, the mutation is undone and the error rethrown.
 *
 * <p>{@link #clear} performs no policy checks of its own. Lenders may call it directly and
 * bypass the risk gateway; that is part of the escrow's trust model, the gateway only
 * protects the funds it lends itself.
 */
@Slf4j
public class EscrowEngine {

    @Getter
    private final String address;
    @Getter
    private final String owner;
    private final AssetLedger collateral;
    private final AssetLedger debt;
    private final EscrowEventSink events;

    private final AppendOnlyBook<LoanRequest> requests = new AppendOnlyBook<>();
    private final AppendOnlyBook<Loan> loans = new AppendOnlyBook<>();

    public EscrowEngine(String address, String owner, AssetLedger collateral, AssetLedger debt,
                        EscrowEventSink events) {
        this.address = address;
        this.owner = owner;
        this.collateral = collateral;
        this.debt = debt;
        this.events = events;
    }

    public String collateralAsset() {
        return collateral.assetId();
    }

    public String debtAsset() {
        return debt.assetId();
    }

    // ----- requests -----

    /**
     * Opens a request and pulls the collateral it needs from {@code caller}.
     *
     * @return the new request id
     */
    public synchronized long request(String caller, BigInteger amount, BigInteger interest,
                                     BigInteger loanToCollateral, long duration) {
        requireNonNegative(amount, "amount");
        requireNonNegative(interest, "interest");
        requireNonNegative(loanToCollateral, "loanToCollateral");
        if (duration < 0) {
            throw new PolicyViolationException(Policy.NEGATIVE_AMOUNT, "duration must be non-negative");
        }
        BigInteger collat = collateralFor(amount, loanToCollateral);

        // pulled before the slot exists: a failed pull allocates nothing
        collateral.transferFrom(address, caller, address, collat);
        long reqId = requests.append(new LoanRequest(amount, interest, loanToCollateral, duration, true));

        log.info("Request {} opened on {}: amount={} interest={} ltc={} duration={}s collateral={}",
                reqId, address, amount, interest, loanToCollateral, duration, collat);
        events.notify(address, reqId, EscrowEvent.REQUESTED);
        return reqId;
    }

    /** Withdraws an active request and refunds its collateral to the owner. */
    public synchronized void rescind(String caller, long reqId) {
        if (!owner.equals(caller)) {
            throw new UnauthorizedException("Only the escrow owner can rescind requests");
        }
        LoanRequest req = activeRequest(reqId);
        BigInteger refund = collateralFor(req.amount(), req.loanToCollateral());

        requests.replace(reqId, req.deactivate());
        try {
            collateral.transfer(address, owner, refund);
        } catch (RuntimeException ex) {
            requests.replace(reqId, req);
            throw ex;
        }

        log.info("Request {} rescinded on {}: refunded {}", reqId, address, refund);
        events.notify(address, reqId, EscrowEvent.RESCINDED);
    }

    /**
     * Fills an active request. {@code caller} becomes the lender and pays the requested
     * amount to the owner.
     *
     * @return the new loan id
     */
    public synchronized long clear(String caller, long reqId, long now) {
        LoanRequest req = activeRequest(reqId);
        LoanRequest frozen = req.deactivate();

        BigInteger interest = interestFor(req.amount(), req.interest(), req.duration());
        BigInteger collat = collateralFor(req.amount(), req.loanToCollateral());
        long expiry = expiryAfter(now, req.duration());

        requests.replace(reqId, frozen);
        long loanId = loans.append(new Loan(frozen, req.amount().add(interest), collat, expiry, true, caller));
        try {
            debt.transferFrom(address, caller, owner, req.amount());
        } catch (RuntimeException ex) {
            loans.discard(loanId);
            requests.replace(reqId, req);
            throw ex;
        }

        log.info("Request {} cleared on {} as loan {}: lender={} owed={} expiry={}",
                reqId, address, loanId, caller, req.amount().add(interest), expiry);
        events.notify(address, reqId, EscrowEvent.CLEARED);
        return loanId;
    }

    // ----- loans -----

    /**
     * Repays part or all of a loan and releases collateral pro rata. Paying the full
     * outstanding amount closes the loan.
     */
    public synchronized void repay(String caller, long loanId, BigInteger repaid, long now) {
        Loan loan = openLoan(loanId);
        if (loan.isExpired(now)) {
            throw new TemporalViolationException(Reason.DEFAULT, loanId, loan.expiry(), now);
        }
        requireNonNegative(repaid, "repaid");
        if (repaid.compareTo(loan.amount()) > 0) {
            throw new PolicyViolationException(Policy.OVER_REPAYMENT,
                    "repaid " + repaid + " exceeds outstanding " + loan.amount());
        }
        BigInteger released = proRata(loan.collateral(), repaid, loan.amount());
        boolean closes = repaid.equals(loan.amount());
        requireCovered(collateral, address, released, "escrow collateral");
        requireCovered(debt, caller, repaid, "repayer balance");
        if (debt.allowance(caller, address).compareTo(repaid) < 0) {
            throw new LedgerTransferException("repayer allowance below " + repaid);
        }

        if (closes) {
            loans.tombstone(loanId);
        } else {
            loans.replace(loanId, loan.withRepayment(repaid, released));
        }
        // escrow-held leg first: if it fails no value has moved
        try {
            collateral.transfer(address, owner, released);
        } catch (RuntimeException ex) {
            loans.replace(loanId, loan);
            throw ex;
        }
        // both legs were checked above; a ledger that still fails here leaves the release
        // in place and only the loan record is restored
        try {
            debt.transferFrom(address, caller, loan.lender(), repaid);
        } catch (RuntimeException ex) {
            loans.replace(loanId, loan);
            log.error("Loan {} on {}: repayment pull failed after {} collateral was released",
                    loanId, address, released, ex);
            throw ex;
        }

        log.info("Loan {} on {} repaid {} (released {} collateral){}",
                loanId, address, repaid, released, closes ? ", closed" : "");
    }

    /**
     * Extends a loan by one more term of its original request: tops collateral back up to
     * the request's ratio, adds a term of interest and pushes expiry out by the duration.
     */
    public synchronized void roll(String caller, long loanId, long now) {
        Loan loan = openLoan(loanId);
        if (loan.isExpired(now)) {
            throw new TemporalViolationException(Reason.DEFAULT, loanId, loan.expiry(), now);
        }
        if (!loan.rollable()) {
            throw new NotRollableException(loanId);
        }
        LoanRequest terms = loan.request();

        // rounding on earlier partial repayments can leave a surplus; never pay it back out here
        BigInteger topUp = collateralFor(loan.amount(), terms.loanToCollateral())
                .subtract(loan.collateral())
                .max(BigInteger.ZERO);
        BigInteger interest = interestFor(loan.amount(), terms.interest(), terms.duration());
        Loan rolled = loan.withRollover(interest, topUp, expiryAfter(loan.expiry(), terms.duration()));

        loans.replace(loanId, rolled);
        try {
            collateral.transferFrom(address, caller, address, topUp);
        } catch (RuntimeException ex) {
            loans.replace(loanId, loan);
            throw ex;
        }

        log.info("Loan {} on {} rolled: owed={} collateral={} expiry={}",
                loanId, address, rolled.amount(), rolled.collateral(), rolled.expiry());
    }

    /** Lender switch for rollover. Returns the new value. */
    public synchronized boolean toggleRoll(String caller, long loanId) {
        Loan loan = openLoan(loanId);
        if (!loan.lender().equals(caller)) {
            throw new UnauthorizedException("Only the lender can toggle rollover of loan " + loanId);
        }
        Loan toggled = loan.withRollable(!loan.rollable());
        loans.replace(loanId, toggled);
        log.info("Loan {} on {} rollable={}", loanId, address, toggled.rollable());
        return toggled.rollable();
    }

    /**
     * Closes an expired loan and hands all of its collateral to the lender. Only the
     * lender may trigger it.
     *
     * @return collateral seized
     */
    public synchronized BigInteger defaulted(String caller, long loanId, long now) {
        Loan loan = openLoan(loanId);
        if (!loan.lender().equals(caller)) {
            throw new UnauthorizedException("Only the lender can claim defaulted loan " + loanId);
        }
        if (!loan.isExpired(now)) {
            throw new TemporalViolationException(Reason.NO_DEFAULT, loanId, loan.expiry(), now);
        }

        loans.tombstone(loanId);
        try {
            collateral.transfer(address, loan.lender(), loan.collateral());
        } catch (RuntimeException ex) {
            loans.replace(loanId, loan);
            throw ex;
        }

        log.info("Loan {} on {} defaulted: {} collateral seized by {}",
                loanId, address, loan.collateral(), loan.lender());
        return loan.collateral();
    }

    // ----- views -----

    public synchronized Optional<LoanRequest> getRequest(long reqId) {
        return requests.find(reqId);
    }

    /** Empty for ids never issued and for closed loans. */
    public synchronized Optional<Loan> getLoan(long loanId) {
        return loans.find(loanId);
    }

    public synchronized long requestCount() {
        return requests.size();
    }

    public synchronized long loanCount() {
        return loans.size();
    }

    private LoanRequest activeRequest(long reqId) {
        LoanRequest req = requests.find(reqId)
                .orElseThrow(() -> new InvalidStateException("Unknown request " + reqId));
        if (!req.active()) {
            throw new InvalidStateException("Request " + reqId + " is not active");
        }
        return req;
    }

    private Loan openLoan(long loanId) {
        return loans.find(loanId)
                .orElseThrow(() -> new InvalidStateException("Loan " + loanId + " is closed or unknown"));
    }

    private static void requireCovered(AssetLedger ledger, String holder, BigInteger amount, String what) {
        if (ledger.balanceOf(holder).compareTo(amount) < 0) {
            throw new LedgerTransferException(what + " below " + amount + " " + ledger.assetId());
        }
    }

    private static long expiryAfter(long from, long duration) {
        try {
            return Math.addExact(from, duration);
        } catch (ArithmeticException ex) {
            throw new PolicyViolationException(Policy.DURATION_OVERFLOW,
                    "expiry " + from + " + " + duration + "s does not fit in a timestamp");
        }
    }

    private static void requireNonNegative(BigInteger value, String name) {
        if (value == null || value.signum() < 0) {
            throw new PolicyViolationException(Policy.NEGATIVE_AMOUNT, name + " must be non-negative");
        }
    }
}
