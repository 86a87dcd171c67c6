package com.flagship.wallet_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * Identity of a running balance: the account plus its owner (null for global accounts).
 */
@Value
public class BalanceKey {
    AccountCode accountCode;
    UUID userId;
}
