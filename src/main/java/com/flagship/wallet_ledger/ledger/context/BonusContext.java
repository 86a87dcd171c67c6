package com.flagship.wallet_ledger.ledger.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.LedgerTransactionType;
import lombok.Value;

/**
 * Loyalty bonus metadata. The reason is mandatory.
 */
@Value
public class BonusContext implements TransactionContext {
    String reason;

    @JsonCreator
    public BonusContext(@JsonProperty("reason") String reason) {
        this.reason = reason;
    }

    @Override
    public LedgerTransactionType type() {
        return LedgerTransactionType.BONUS;
    }
}
