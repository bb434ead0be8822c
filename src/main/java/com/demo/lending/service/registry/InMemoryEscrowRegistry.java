package com.demo.lending.service.registry;

import com.demo.lending.service.HashUtil;
import com.demo.lending.service.escrow.EscrowEngine;
import com.demo.lending.service.events.EscrowEventSink;
import com.demo.lending.service.ledger.AssetLedger;
import com.demo.lending.service.ledger.AssetLedgers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class InMemoryEscrowRegistry implements EscrowRegistry {

    private final AssetLedgers ledgers;
    private final EscrowEventSink events;

    private final Map<EscrowKey, EscrowEngine> byKey = new LinkedHashMap<>();
    private final Map<String, EscrowEngine> byAddress = new LinkedHashMap<>();

    @Override
    public synchronized String generate(String owner, String collateralAsset, String debtAsset) {
        EscrowKey key = new EscrowKey(owner, collateralAsset, debtAsset);
        EscrowEngine existing = byKey.get(key);
        if (existing != null) {
            return existing.getAddress();
        }
        AssetLedger collateral = ledgers.require(collateralAsset);
        AssetLedger debt = ledgers.require(debtAsset);
        String address = HashUtil.escrowAddress(owner, collateralAsset, debtAsset);

        EscrowEngine escrow = new EscrowEngine(address, owner, collateral, debt, events);
        byKey.put(key, escrow);
        byAddress.put(address, escrow);
        log.info("Escrow {} created for owner={} collateral={} debt={}", address, owner, collateralAsset, debtAsset);
        return address;
    }

    @Override
    public synchronized boolean isGenuine(String escrowId) {
        return byAddress.containsKey(escrowId);
    }

    @Override
    public synchronized Optional<EscrowEngine> find(String escrowId) {
        return Optional.ofNullable(byAddress.get(escrowId));
    }

    @Override
    public synchronized Collection<EscrowEngine> list() {
        return Collections.unmodifiableList(new ArrayList<>(byAddress.values()));
    }
}
