package com.flagship.wallet_ledger.ledger.exception;

import java.util.UUID;

/**
 * Thrown when a posting would drive a customer credit balance below zero.
 */
public class InsufficientFundsException extends LedgerException {

    private final UUID userId;
    private final long balanceMinor;
    private final long requiredMinor;

    public InsufficientFundsException(UUID userId, long balanceMinor, long requiredMinor) {
        super(LedgerErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds for user %s. Current balance: %d, required: %d",
                userId, balanceMinor, requiredMinor));
        this.userId = userId;
        this.balanceMinor = balanceMinor;
        this.requiredMinor = requiredMinor;
    }

    public UUID getUserId() {
        return userId;
    }

    public long getBalanceMinor() {
        return balanceMinor;
    }

    public long getRequiredMinor() {
        return requiredMinor;
    }
}
