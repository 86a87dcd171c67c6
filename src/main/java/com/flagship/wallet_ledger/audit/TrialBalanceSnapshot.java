package com.flagship.wallet_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Stored result of the last trial balance run of a day.
 */
@Value
public class TrialBalanceSnapshot {
    LocalDate asOfDate;
    long sumDebit;
    long sumCredit;
    long delta;
    TrialBalanceStatus status;
    String details;
    Instant computedAt;
}
