package com.flagship.wallet_ledger.ledger.exception;

/**
 * Thrown when a request reaches the ledger with malformed input.
 */
public class ValidationFailedException extends LedgerException {

    public ValidationFailedException(String message) {
        super(LedgerErrorCode.VALIDATION_FAILED, message);
    }

    public ValidationFailedException(String message, Throwable cause) {
        super(LedgerErrorCode.VALIDATION_FAILED, message, cause);
    }
}
