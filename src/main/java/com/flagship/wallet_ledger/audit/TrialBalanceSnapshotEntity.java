package com.flagship.wallet_ledger.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Read-side JPA mapping of trial_balance_daily. Rows are written by TrialBalanceAuditor's upsert.
 */
@Entity
@Table(name = "trial_balance_daily")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TrialBalanceSnapshotEntity {

    @Id
    @Column(name = "as_of_date", nullable = false, updatable = false)
    private LocalDate asOfDate;

    @Column(name = "sum_debit", nullable = false)
    private long sumDebit;

    @Column(name = "sum_credit", nullable = false)
    private long sumCredit;

    @Column(name = "delta", nullable = false)
    private long delta;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TrialBalanceStatus status;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    TrialBalanceSnapshot toDomain() {
        return new TrialBalanceSnapshot(asOfDate, sumDebit, sumCredit, delta, status, details, computedAt);
    }
}
