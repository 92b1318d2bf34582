package com.kmg.gateway.service;

/**
 * A ledger operation lost its race for the caller's account (version moved or the caller lock
 * could not be acquired in time). Retried inside the ledger; surfaced only once retries run out.
 */
public class LedgerConflictException extends RuntimeException {
    private final String callerId;

    public LedgerConflictException(String callerId, String message) {
        super(message);
        this.callerId = callerId;
    }

    public String getCallerId() {
        return callerId;
    }
}
