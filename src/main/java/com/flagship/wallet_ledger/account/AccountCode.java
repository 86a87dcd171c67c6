package com.flagship.wallet_ledger.account;

import com.flagship.wallet_ledger.ledger.EntrySide;
import com.flagship.wallet_ledger.ledger.exception.ValidationFailedException;

/**
 * Chart of accounts. These four codes are the only valid ones.
 *
 * Asset and expense accounts grow on debit; liability and revenue accounts grow on credit.
 * Only CUSTOMER_CREDITS is owned by a user; the others are global.
 */
public enum AccountCode {
    CASH_CLEARING(1000, false, EntrySide.DEBIT),
    CUSTOMER_CREDITS(2000, true, EntrySide.CREDIT),
    SALES_REVENUE(4000, false, EntrySide.CREDIT),
    MARKETING_EXPENSE(5000, false, EntrySide.DEBIT);

    private final int code;
    private final boolean userScoped;
    private final EntrySide normalSide;

    AccountCode(int code, boolean userScoped, EntrySide normalSide) {
        this.code = code;
        this.userScoped = userScoped;
        this.normalSide = normalSide;
    }

    public int getCode() {
        return code;
    }

    public boolean isUserScoped() {
        return userScoped;
    }

    public EntrySide getNormalSide() {
        return normalSide;
    }

    /**
     * Effect of a posting on this account's running balance.
     */
    public long signedAmount(EntrySide side, long amountMinor) {
        return side == normalSide ? amountMinor : -amountMinor;
    }

    public static AccountCode of(int code) {
        for (AccountCode account : values()) {
            if (account.code == code) {
                return account;
            }
        }
        throw new ValidationFailedException("Unknown account code: " + code);
    }

    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
