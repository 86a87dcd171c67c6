package com.flagship.wallet_ledger.ledger.exception;

/**
 * Base exception for all ledger domain failures.
 * Storage failures are not wrapped; they propagate as Spring DataAccessExceptions.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    protected LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }

    public boolean isRecoverable() {
        return code.isRecoverable();
    }
}
