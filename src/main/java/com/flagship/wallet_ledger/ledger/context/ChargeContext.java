package com.flagship.wallet_ledger.ledger.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.LedgerTransactionType;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChargeContext implements TransactionContext {
    String note;

    @JsonCreator
    public ChargeContext(@JsonProperty("note") String note) {
        this.note = note;
    }

    @Override
    public LedgerTransactionType type() {
        return LedgerTransactionType.CHARGE;
    }
}
