package com.demo.lending.service.gateway;

import com.demo.lending.service.ledger.AssetLedgers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Treasury backed by a plain ledger identity.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerTreasury implements Treasury {

    private final String address;
    private final AssetLedgers ledgers;

    @Override
    public String address() {
        return address;
    }

    @Override
    public void fund(String assetId, String recipient, BigInteger amount) {
        ledgers.require(assetId).transfer(address, recipient, amount);
        log.info("Treasury {} funded {} {} to {}", address, amount, assetId, recipient);
    }
}
