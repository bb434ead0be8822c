package com.demo.lending.service.ledger;

import com.demo.lending.exception.LedgerTransferException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-local ledger used for standalone runs and tests.
 */
@Slf4j
public class InMemoryAssetLedger implements AssetLedger {

    private final String assetId;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<AllowanceKey, BigInteger> allowances = new HashMap<>();

    public InMemoryAssetLedger(String assetId) {
        this.assetId = assetId;
    }

    @Override
    public String assetId() {
        return assetId;
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        move(from, to, amount);
    }

    @Override
    public synchronized void transferFrom(String spender, String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        AllowanceKey key = new AllowanceKey(from, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw new LedgerTransferException(String.format(
                    "%s: insufficient allowance for %s from %s (allowed %s, requested %s)",
                    assetId, spender, from, allowed, amount));
        }
        move(from, to, amount);
        allowances.put(key, allowed.subtract(amount));
    }

    @Override
    public synchronized void approve(String owner, String spender, BigInteger amount) {
        requireNonNegative(amount);
        allowances.put(new AllowanceKey(owner, spender), amount);
    }

    @Override
    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
    }

    /** Credits new units to {@code to}. Faucet for local runs. */
    public synchronized void mint(String to, BigInteger amount) {
        requireNonNegative(amount);
        balances.merge(to, amount, BigInteger::add);
        log.info("{}: minted {} to {}", assetId, amount, to);
    }

    private void move(String from, String to, BigInteger amount) {
        BigInteger available = balances.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            throw new LedgerTransferException(String.format(
                    "%s: insufficient balance for %s (available %s, requested %s)",
                    assetId, from, available, amount));
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        log.debug("{}: {} -> {} amount={}", assetId, from, to, amount);
    }

    private void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new LedgerTransferException(assetId + ": amount must be non-negative");
        }
    }

    private record AllowanceKey(String owner, String spender) {}
}
