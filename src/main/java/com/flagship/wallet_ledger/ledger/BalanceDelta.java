package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import lombok.Value;

import java.util.UUID;

/**
 * Signed change to apply to one running balance.
 */
@Value
public class BalanceDelta {
    AccountCode accountCode;
    UUID userId;
    long delta;

    public static BalanceDelta of(AccountCode accountCode, UUID userId, long delta) {
        return new BalanceDelta(accountCode, userId, delta);
    }

    public static BalanceDelta global(AccountCode accountCode, long delta) {
        return new BalanceDelta(accountCode, null, delta);
    }
}
