package com.demo.lending.service;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class HashUtil {

    /** Address-shaped id for an escrow: last 20 bytes of sha256(owner|collateral|debt). */
    public static String escrowAddress(String owner, String collateralAsset, String debtAsset) {
        byte[] digest = Hash.sha256((owner + "|" + collateralAsset + "|" + debtAsset).getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexString(Arrays.copyOfRange(digest, 12, 32));
    }
}
