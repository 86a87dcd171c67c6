package com.flagship.wallet_ledger.ledger.exception;

import java.util.UUID;

/**
 * Thrown when a referenced ledger transaction does not exist.
 */
public class TransactionNotFoundException extends LedgerException {

    public TransactionNotFoundException(UUID txId) {
        super(LedgerErrorCode.TX_NOT_FOUND, "Transaction " + txId + " not found");
    }
}
