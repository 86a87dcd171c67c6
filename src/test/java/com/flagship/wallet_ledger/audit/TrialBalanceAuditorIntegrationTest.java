package com.flagship.wallet_ledger.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Audits run against real data, including entries and balances corrupted behind the ledger's back.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class TrialBalanceAuditorIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private TrialBalanceAuditor auditor;

    @Autowired
    private BalanceReconciler reconciler;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID userId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE ledger_entries, ledger_transactions, account_balances, "
            + "trial_balance_daily, outbox_events CASCADE");
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("An empty ledger is balanced")
    void emptyLedgerIsBalanced() {
        TrialBalanceResult result = auditor.run();

        assertEquals(TrialBalanceStatus.OK, result.getStatus());
        assertEquals(0, result.getSumDebit());
        assertEquals(0, result.getSumCredit());
    }

    @Test
    @DisplayName("The day's snapshot is stored and overwritten by later runs")
    void snapshotIsStoredPerDay() {
        ledgerService.topup(userId, 1000, null);
        TrialBalanceResult first = auditor.run();
        ledgerService.charge(userId, 250, null);
        TrialBalanceResult second = auditor.run();

        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        assertEquals(today, second.getAsOfDate());
        assertEquals(1000, first.getSumDebit());
        assertEquals(1250, second.getSumDebit());

        TrialBalanceSnapshot snapshot = auditor.findSnapshot(second.getAsOfDate()).orElseThrow();
        assertEquals(1250, snapshot.getSumDebit());
        assertEquals(1250, snapshot.getSumCredit());
        assertEquals(TrialBalanceStatus.OK, snapshot.getStatus());
        assertNull(snapshot.getDetails());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM trial_balance_daily", Integer.class));
        assertEquals(snapshot, auditor.findLatestSnapshot().orElseThrow());
    }

    @Test
    @DisplayName("Runs racing on the same day all succeed and leave one snapshot")
    void concurrentRunsShareOneSnapshot() throws Exception {
        ledgerService.topup(userId, 1000, null);

        List<Callable<TrialBalanceResult>> runs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            runs.add(auditor::run);
        }
        ExecutorService executor = Executors.newFixedThreadPool(6);
        try {
            for (Future<TrialBalanceResult> future : executor.invokeAll(runs, 60, TimeUnit.SECONDS)) {
                assertEquals(TrialBalanceStatus.OK, future.get().getStatus());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM trial_balance_daily", Integer.class));
        assertEquals(1000, auditor.findLatestSnapshot().orElseThrow().getSumDebit());
    }

    @Test
    @DisplayName("A one-sided entry written outside the ledger is detected and not repaired")
    void detectsOneSidedEntry() throws Exception {
        ledgerService.topup(userId, 1000, null);
        UUID rogueTx = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO ledger_transactions (id, type, context) VALUES (?, 'topup', '{}')", rogueTx);
        jdbcTemplate.update("INSERT INTO ledger_entries (id, tx_id, account_code, user_id, side, amount_minor) "
            + "VALUES (?, ?, 1000, NULL, 'debit', 75)", UUID.randomUUID(), rogueTx);

        TrialBalanceResult result = auditor.run();

        assertEquals(TrialBalanceStatus.MISMATCH, result.getStatus());
        assertEquals(75, result.getDelta());
        TrialBalanceSnapshot snapshot = auditor.findSnapshot(result.getAsOfDate()).orElseThrow();
        assertEquals(TrialBalanceStatus.MISMATCH, snapshot.getStatus());
        assertEquals(TrialBalanceAuditor.MISMATCH_ERROR,
            objectMapper.readTree(snapshot.getDetails()).get("error").asText());
        assertEquals(3, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_entries", Integer.class));

        List<BalanceDrift> drifts = reconciler.reconcile();
        assertEquals(List.of(new BalanceDrift(AccountCode.CASH_CLEARING, null, 1000, 1075)), drifts);
    }

    @Test
    @DisplayName("A balance edited outside the ledger shows up as drift")
    void detectsEditedBalance() {
        ledgerService.topup(userId, 1000, null);
        ledgerService.bonus(userId, 100, "welcome");
        assertTrue(reconciler.reconcile().isEmpty());

        jdbcTemplate.update("UPDATE account_balances SET balance_minor = 5000 WHERE account_code = 2000 AND user_id = ?",
            userId);

        List<BalanceDrift> drifts = reconciler.reconcile();
        assertEquals(List.of(new BalanceDrift(AccountCode.CUSTOMER_CREDITS, userId, 5000, 1100)), drifts);
        assertEquals(TrialBalanceStatus.OK, auditor.run().getStatus());
        assertEquals(5000, ledgerService.getBalance(userId).getBalanceMinor());
    }
}
