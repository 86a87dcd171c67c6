package com.flagship.wallet_ledger.ledger;

import lombok.Value;

/**
 * Sums of all debit and credit entries across the entry store.
 */
@Value
public class EntryTotals {
    long sumDebit;
    long sumCredit;

    public long getDelta() {
        return sumDebit - sumCredit;
    }
}
