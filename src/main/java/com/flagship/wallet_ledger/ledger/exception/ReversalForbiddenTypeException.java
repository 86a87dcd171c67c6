package com.flagship.wallet_ledger.ledger.exception;

import java.util.UUID;

/**
 * Thrown on an attempt to reverse a reversal transaction.
 */
public class ReversalForbiddenTypeException extends LedgerException {

    public ReversalForbiddenTypeException(UUID txId) {
        super(LedgerErrorCode.REVERSAL_FORBIDDEN_TYPE,
            "Cannot reverse a reversal transaction: " + txId);
    }
}
