package com.flagship.wallet_ledger.audit;

public enum TrialBalanceStatus {
    OK,
    MISMATCH
}
