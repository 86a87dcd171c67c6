package com.flagship.wallet_ledger.audit;

import com.flagship.wallet_ledger.account.AccountBalance;
import com.flagship.wallet_ledger.account.AccountBalanceStore;
import com.flagship.wallet_ledger.account.BalanceKey;
import com.flagship.wallet_ledger.ledger.AccountSideTotal;
import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays the entry log into per-(account, owner) totals and compares them with the
 * stored running balances.
 *
 * Reads both sides from one snapshot (REPEATABLE READ) so postings committed mid-run
 * do not show up as drift. Reports only; never corrects a balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceReconciler {

    private static final Comparator<BalanceDrift> DRIFT_ORDER = Comparator
        .comparingInt((BalanceDrift drift) -> drift.getAccountCode().getCode())
        .thenComparing(drift -> String.valueOf(drift.getUserId()));

    private final TransactionLog transactionLog;
    private final AccountBalanceStore balanceStore;
    private final LedgerMetrics metrics;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<BalanceDrift> reconcile() {
        Map<BalanceKey, Long> replayed = new HashMap<>();
        for (AccountSideTotal total : transactionLog.sumEntriesByAccount()) {
            replayed.merge(new BalanceKey(total.getAccountCode(), total.getUserId()),
                total.getAccountCode().signedAmount(total.getSide(), total.getTotalMinor()), Long::sum);
        }

        Map<BalanceKey, Long> stored = new HashMap<>();
        for (AccountBalance balance : balanceStore.findAll()) {
            stored.put(balance.key(), balance.getBalanceMinor());
        }

        Set<BalanceKey> keys = new HashSet<>(stored.keySet());
        keys.addAll(replayed.keySet());

        List<BalanceDrift> drifts = new ArrayList<>();
        for (BalanceKey key : keys) {
            long storedMinor = stored.getOrDefault(key, 0L);
            long replayedMinor = replayed.getOrDefault(key, 0L);
            if (storedMinor != replayedMinor) {
                drifts.add(new BalanceDrift(key.getAccountCode(), key.getUserId(), storedMinor, replayedMinor));
            }
        }
        drifts.sort(DRIFT_ORDER);

        metrics.recordBalanceDrift(drifts.size());
        if (drifts.isEmpty()) {
            log.info("Reconciled {} balances, no drift", keys.size());
        } else {
            drifts.forEach(drift -> log.error("Balance drift: account={}, userId={}, stored={}, replayed={}",
                drift.getAccountCode(), drift.getUserId(), drift.getStoredMinor(), drift.getReplayedMinor()));
        }
        return drifts;
    }
}
