package com.flagship.wallet_ledger.ledger.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.LedgerTransactionType;
import lombok.Value;

import java.util.UUID;

/**
 * Back-reference to the transaction being undone.
 */
@Value
public class ReversalContext implements TransactionContext {
    UUID originalTxId;

    @JsonCreator
    public ReversalContext(@JsonProperty("originalTxId") UUID originalTxId) {
        this.originalTxId = originalTxId;
    }

    @Override
    public LedgerTransactionType type() {
        return LedgerTransactionType.REVERSAL;
    }
}
