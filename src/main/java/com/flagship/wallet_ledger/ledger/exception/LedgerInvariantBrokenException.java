package com.flagship.wallet_ledger.ledger.exception;

/**
 * Internal defect: a posting does not balance, has the wrong shape,
 * or stored data cannot be interpreted. Never recoverable by retry.
 */
public class LedgerInvariantBrokenException extends LedgerException {

    public LedgerInvariantBrokenException(String message) {
        super(LedgerErrorCode.LEDGER_INVARIANT_BROKEN, message);
    }

    public LedgerInvariantBrokenException(String message, Throwable cause) {
        super(LedgerErrorCode.LEDGER_INVARIANT_BROKEN, message, cause);
    }
}
