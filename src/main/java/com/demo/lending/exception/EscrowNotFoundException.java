package com.demo.lending.exception;

public class EscrowNotFoundException extends LendingException {

    public EscrowNotFoundException(String escrowId) {
        super("Escrow not found: " + escrowId);
    }
}
