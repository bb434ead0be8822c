package com.demo.lending.service.ledger;

import java.math.BigInteger;

/**
 * Fungible balance capability for a single asset. Identities are opaque strings.
 *
 * <p>Implementations must fail (throw) rather than partially apply a transfer and must not
 * call back into the caller beyond returning or throwing.
 */
public interface AssetLedger {

    String assetId();

    BigInteger balanceOf(String holder);

    /** Moves {@code amount} out of {@code from}'s own balance. */
    void transfer(String from, String to, BigInteger amount);

    /** Moves {@code amount} from {@code from}, who must have authorized {@code spender} for at least that much. */
    void transferFrom(String spender, String from, String to, BigInteger amount);

    /** Sets the amount {@code spender} may pull from {@code owner}. */
    void approve(String owner, String spender, BigInteger amount);

    BigInteger allowance(String owner, String spender);
}
