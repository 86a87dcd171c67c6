package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;

import java.util.Locale;

/**
 * The two sides of a balanced posting.
 * Stored lowercase in the ledger_entries.side column.
 */
public enum EntrySide {
    DEBIT,
    CREDIT;

    public EntrySide opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntrySide fromDbValue(String value) {
        for (EntrySide side : values()) {
            if (side.dbValue().equals(value)) {
                return side;
            }
        }
        throw new LedgerInvariantBrokenException("Unknown entry side in storage: " + value);
    }
}
