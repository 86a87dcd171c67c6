package com.flagship.wallet_ledger.ledger.context;

import com.flagship.wallet_ledger.ledger.LedgerTransactionType;

/**
 * Typed metadata carried by a ledger transaction header.
 * Each transaction type has exactly one context implementation, stored as JSONB.
 */
public interface TransactionContext {

    LedgerTransactionType type();
}
