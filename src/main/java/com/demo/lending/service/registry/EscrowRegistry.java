package com.demo.lending.service.registry;

import com.demo.lending.service.escrow.EscrowEngine;

import java.util.Collection;
import java.util.Optional;

public interface EscrowRegistry {

    /** Returns the escrow for the triple, creating it on first use. */
    String generate(String owner, String collateralAsset, String debtAsset);

    /** True only for escrows this registry created. */
    boolean isGenuine(String escrowId);

    Optional<EscrowEngine> find(String escrowId);

    Collection<EscrowEngine> list();
}
