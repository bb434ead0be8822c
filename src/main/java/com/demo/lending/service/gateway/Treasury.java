package com.demo.lending.service.gateway;

import java.math.BigInteger;

/**
 * Source of the funds the gateway lends out. Whether a funding call is allowed is the
 * treasury's own business.
 */
public interface Treasury {

    /** Ledger identity that defunded assets are returned to. */
    String address();

    void fund(String assetId, String recipient, BigInteger amount);
}
