package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of a user's transaction history, newest first.
 * nextCursor is null when hasMore is false.
 */
@Value
public class TransactionPage {
    List<LedgerTransaction> transactions;
    String nextCursor;
    boolean hasMore;
}
