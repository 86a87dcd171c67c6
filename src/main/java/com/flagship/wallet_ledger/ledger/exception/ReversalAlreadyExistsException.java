package com.flagship.wallet_ledger.ledger.exception;

import java.util.UUID;

/**
 * Thrown when the original transaction has already been reversed once.
 */
public class ReversalAlreadyExistsException extends LedgerException {

    private final UUID originalTxId;

    public ReversalAlreadyExistsException(UUID originalTxId) {
        super(LedgerErrorCode.REVERSAL_ALREADY_EXISTS,
            "Transaction " + originalTxId + " has already been reversed");
        this.originalTxId = originalTxId;
    }

    public ReversalAlreadyExistsException(UUID originalTxId, Throwable cause) {
        super(LedgerErrorCode.REVERSAL_ALREADY_EXISTS,
            "Transaction " + originalTxId + " has already been reversed", cause);
        this.originalTxId = originalTxId;
    }

    public UUID getOriginalTxId() {
        return originalTxId;
    }
}
