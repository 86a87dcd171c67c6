package com.flagship.wallet_ledger.audit;

import com.flagship.wallet_ledger.account.AccountCode;
import lombok.Value;

import java.util.UUID;

/**
 * A running balance that disagrees with the sum of its entries.
 */
@Value
public class BalanceDrift {
    AccountCode accountCode;
    UUID userId;
    long storedMinor;
    long replayedMinor;

    public long getDifference() {
        return storedMinor - replayedMinor;
    }
}
