package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.context.TransactionContext;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable header of a recorded financial event.
 *
 * reversalOf is set only for REVERSAL transactions; createdAt is assigned by the database.
 */
@Value
public class LedgerTransaction {
    UUID id;
    LedgerTransactionType type;
    TransactionContext context;
    UUID reversalOf;
    Instant createdAt;

    public boolean isReversal() {
        return type == LedgerTransactionType.REVERSAL;
    }
}
