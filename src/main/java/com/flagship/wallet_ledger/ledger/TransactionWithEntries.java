package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A transaction header together with its postings, debit first.
 */
@Value
public class TransactionWithEntries {
    LedgerTransaction transaction;
    List<LedgerEntry> entries;

    public UUID getTxId() {
        return transaction.getId();
    }
}
