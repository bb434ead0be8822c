package com.demo.lending.exception;

/**
 * Thrown by an asset ledger when a transfer cannot be honoured
 */
public class LedgerTransferException extends LendingException {

    public LedgerTransferException(String message) {
        super(message);
    }
}
