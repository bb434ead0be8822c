package com.demo.lending.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import org.web3j.crypto.WalletUtils;

/**
 * Identity handling at the HTTP edge: addresses must be 0x-prefixed 20-byte hex and are
 * compared in lower case.
 */
final class Callers {

    static final String HEADER = "X-Caller";

    private Callers() {}

    static String require(String address) {
        if (address == null || address.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, HEADER + " header required");
        }
        return normalize(address);
    }

    /** Normalized address, or {@code null} when absent. */
    static String optional(String address) {
        return (address == null || address.isBlank()) ? null : normalize(address);
    }

    static String normalize(String address) {
        String trimmed = address.trim();
        if (!trimmed.startsWith("0x") || !WalletUtils.isValidAddress(trimmed)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "not an address: " + address);
        }
        return trimmed.toLowerCase();
    }
}
