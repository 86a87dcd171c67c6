package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.context.BonusContext;
import com.flagship.wallet_ledger.ledger.context.ChargeContext;
import com.flagship.wallet_ledger.ledger.context.ReversalContext;
import com.flagship.wallet_ledger.ledger.context.TopupContext;
import com.flagship.wallet_ledger.ledger.context.TransactionContext;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;

import java.util.Locale;

/**
 * Kinds of financial events the ledger records, each bound to its context payload type.
 */
public enum LedgerTransactionType {
    TOPUP(TopupContext.class),
    CHARGE(ChargeContext.class),
    BONUS(BonusContext.class),
    REVERSAL(ReversalContext.class);

    private final Class<? extends TransactionContext> contextType;

    LedgerTransactionType(Class<? extends TransactionContext> contextType) {
        this.contextType = contextType;
    }

    public Class<? extends TransactionContext> getContextType() {
        return contextType;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LedgerTransactionType fromDbValue(String value) {
        for (LedgerTransactionType type : values()) {
            if (type.dbValue().equals(value)) {
                return type;
            }
        }
        throw new LedgerInvariantBrokenException("Unknown transaction type in storage: " + value);
    }
}
