package com.flagship.wallet_ledger.ledger.exception;

/**
 * Failure codes surfaced by the ledger engine.
 *
 * Recoverable codes describe a request the caller can fix or reject in the UI.
 * LEDGER_INVARIANT_BROKEN is a data-integrity incident and must not be retried.
 */
public enum LedgerErrorCode {
    VALIDATION_FAILED(true),
    INSUFFICIENT_FUNDS(true),
    TX_NOT_FOUND(true),
    REVERSAL_FORBIDDEN_TYPE(true),
    REVERSAL_ALREADY_EXISTS(true),
    LEDGER_INVARIANT_BROKEN(false);

    private final boolean recoverable;

    LedgerErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
