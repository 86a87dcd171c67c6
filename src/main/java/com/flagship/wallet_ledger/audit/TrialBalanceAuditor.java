package com.flagship.wallet_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.EntryTotals;
import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Global check that total debits equal total credits across the whole entry store.
 *
 * The result is upserted as today's snapshot (UTC), so concurrent or repeated runs on one day
 * leave a single row holding the latest result. A mismatch is reported, never repaired:
 * balances and entries are left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrialBalanceAuditor {

    static final String MISMATCH_ERROR = "Debit/Credit mismatch detected";

    static final String UPSERT_SNAPSHOT = """
        INSERT INTO trial_balance_daily (as_of_date, sum_debit, sum_credit, delta, status, details, computed_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (as_of_date)
        DO UPDATE SET sum_debit = EXCLUDED.sum_debit,
                      sum_credit = EXCLUDED.sum_credit,
                      delta = EXCLUDED.delta,
                      status = EXCLUDED.status,
                      details = EXCLUDED.details,
                      computed_at = EXCLUDED.computed_at
        """;

    private final TransactionLog transactionLog;
    private final TrialBalanceSnapshotRepository snapshotRepository;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public TrialBalanceResult run() {
        EntryTotals totals = transactionLog.sumEntriesBySide();
        LocalDate today = LocalDate.now(clock);
        TrialBalanceStatus status = totals.getDelta() == 0 ? TrialBalanceStatus.OK : TrialBalanceStatus.MISMATCH;
        TrialBalanceResult result = new TrialBalanceResult(
            today, status, totals.getSumDebit(), totals.getSumCredit(), totals.getDelta());

        jdbcTemplate.update(UPSERT_SNAPSHOT,
            today,
            result.getSumDebit(),
            result.getSumCredit(),
            result.getDelta(),
            status.name(),
            result.isOk() ? null : mismatchDetails(result),
            Timestamp.from(clock.instant()));

        metrics.recordTrialBalance(status.name(), result.getDelta());
        if (result.isOk()) {
            log.info("Trial balance OK for {}: debit={}, credit={}", today, result.getSumDebit(), result.getSumCredit());
        } else {
            log.error("Trial balance MISMATCH for {}: debit={}, credit={}, delta={}",
                today, result.getSumDebit(), result.getSumCredit(), result.getDelta());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public Optional<TrialBalanceSnapshot> findSnapshot(LocalDate asOfDate) {
        return snapshotRepository.findById(asOfDate).map(TrialBalanceSnapshotEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<TrialBalanceSnapshot> findLatestSnapshot() {
        return snapshotRepository.findTopByOrderByAsOfDateDesc().map(TrialBalanceSnapshotEntity::toDomain);
    }

    private String mismatchDetails(TrialBalanceResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", MISMATCH_ERROR);
        details.put("sumDebit", result.getSumDebit());
        details.put("sumCredit", result.getSumCredit());
        details.put("delta", result.getDelta());
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trial balance details", e);
        }
    }
}
