package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import lombok.Value;

import java.util.UUID;

/**
 * One side of a posting before it is written to the entry store.
 */
@Value
public class PostingLeg {
    AccountCode accountCode;
    UUID userId;
    EntrySide side;
    long amountMinor;

    public static PostingLeg debit(AccountCode accountCode, UUID userId, long amountMinor) {
        return new PostingLeg(accountCode, userId, EntrySide.DEBIT, amountMinor);
    }

    public static PostingLeg credit(AccountCode accountCode, UUID userId, long amountMinor) {
        return new PostingLeg(accountCode, userId, EntrySide.CREDIT, amountMinor);
    }
}
