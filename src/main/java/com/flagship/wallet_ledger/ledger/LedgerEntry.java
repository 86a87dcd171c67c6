package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import lombok.Value;

import java.util.UUID;

/**
 * A persisted debit or credit posting. Never updated after creation.
 *
 * userId is null for the global accounts (1000, 4000, 5000).
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID txId;
    AccountCode accountCode;
    UUID userId;
    EntrySide side;
    long amountMinor;

    /**
     * The same posting on the opposite side, used to build a reversal.
     */
    public PostingLeg mirror() {
        return new PostingLeg(accountCode, userId, side.opposite(), amountMinor);
    }
}
