package com.flagship.wallet_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Running total for one (account, owner) pair, maintained incrementally by every posting.
 */
@Value
public class AccountBalance {
    AccountCode accountCode;
    UUID userId;
    long balanceMinor;
    Instant updatedAt;

    public BalanceKey key() {
        return new BalanceKey(accountCode, userId);
    }
}
