package com.flagship.wallet_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code ledger} prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * When false, write operations are rejected. Reads keep working.
     */
    private boolean enabled = true;

    private String version = "1.0.0";

    private Transactions transactions = new Transactions();

    private TrialBalance trialBalance = new TrialBalance();

    @Getter
    @Setter
    public static class Transactions {
        private int defaultLimit = 20;
        private int maxLimit = 100;
    }

    @Getter
    @Setter
    public static class TrialBalance {
        private boolean scheduled = true;
        private String cron = "0 5 0 * * *";
    }
}
