package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.audit.TrialBalanceAuditor;
import com.flagship.wallet_ledger.audit.TrialBalanceSnapshot;
import com.flagship.wallet_ledger.audit.TrialBalanceStatus;
import com.flagship.wallet_ledger.config.LedgerProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reports ledger version, chart of accounts, feature flags and the latest trial balance.
 * WARNING when the latest trial balance found a mismatch.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerProperties properties;
    private final TrialBalanceAuditor auditor;

    public LedgerHealthIndicator(LedgerProperties properties, TrialBalanceAuditor auditor) {
        this.properties = properties;
        this.auditor = auditor;
    }

    @Override
    public Health health() {
        try {
            Optional<TrialBalanceSnapshot> latest = auditor.findLatestSnapshot();
            boolean mismatch = latest.map(s -> s.getStatus() == TrialBalanceStatus.MISMATCH).orElse(false);

            Health.Builder builder = mismatch ? Health.status("WARNING") : Health.up();

            List<String> accounts = Arrays.stream(AccountCode.values())
                    .map(AccountCode::toString)
                    .toList();
            Map<String, Object> featureFlags = new LinkedHashMap<>();
            featureFlags.put("ledgerEnabled", properties.isEnabled());
            featureFlags.put("trialBalanceScheduled", properties.getTrialBalance().isScheduled());

            builder.withDetail("version", properties.getVersion())
                    .withDetail("accounts", accounts)
                    .withDetail("featureFlags", featureFlags);
            latest.ifPresent(snapshot -> builder
                    .withDetail("trialBalanceDate", snapshot.getAsOfDate().toString())
                    .withDetail("trialBalanceStatus", snapshot.getStatus().name())
                    .withDetail("trialBalanceDelta", snapshot.getDelta()));
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
