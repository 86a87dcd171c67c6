package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import lombok.Value;

import java.util.UUID;

/**
 * Sum of entry amounts for one (account, user, side) group.
 */
@Value
public class AccountSideTotal {
    AccountCode accountCode;
    UUID userId;
    EntrySide side;
    long totalMinor;
}
