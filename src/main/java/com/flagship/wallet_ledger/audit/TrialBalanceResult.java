package com.flagship.wallet_ledger.audit;

import lombok.Value;

import java.time.LocalDate;

/**
 * Outcome of one trial balance run. {@code delta} is sumDebit minus sumCredit.
 */
@Value
public class TrialBalanceResult {
    LocalDate asOfDate;
    TrialBalanceStatus status;
    long sumDebit;
    long sumCredit;
    long delta;

    public boolean isOk() {
        return status == TrialBalanceStatus.OK;
    }
}
