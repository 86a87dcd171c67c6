package com.flagship.wallet_ledger.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the trial balance once a day, shortly after midnight UTC by default.
 */
@Component
@ConditionalOnProperty(name = "ledger.trial-balance.scheduled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TrialBalanceScheduler {

    private final TrialBalanceAuditor auditor;

    @Scheduled(cron = "${ledger.trial-balance.cron:0 5 0 * * *}", zone = "UTC")
    public void runDailyTrialBalance() {
        try {
            auditor.run();
        } catch (Exception e) {
            log.error("Scheduled trial balance failed", e);
        }
    }
}
