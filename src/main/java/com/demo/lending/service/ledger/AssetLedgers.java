package com.demo.lending.service.ledger;

import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.PolicyViolationException.Policy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directory of the ledgers this deployment can address, keyed by asset id.
 */
public class AssetLedgers {

    private final Map<String, AssetLedger> byAsset = new LinkedHashMap<>();

    public AssetLedgers(Collection<? extends AssetLedger> ledgers) {
        for (AssetLedger ledger : ledgers) {
            if (byAsset.putIfAbsent(ledger.assetId(), ledger) != null) {
                throw new IllegalArgumentException("Duplicate ledger for asset " + ledger.assetId());
            }
        }
    }

    public AssetLedger require(String assetId) {
        AssetLedger ledger = byAsset.get(assetId);
        if (ledger == null) {
            throw new PolicyViolationException(Policy.UNSUPPORTED_ASSET, "no ledger for asset " + assetId);
        }
        return ledger;
    }

    public Collection<AssetLedger> all() {
        return Collections.unmodifiableCollection(byAsset.values());
    }
}
