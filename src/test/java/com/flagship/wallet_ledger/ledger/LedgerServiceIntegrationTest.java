package com.flagship.wallet_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.account.AccountBalanceStore;
import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.audit.BalanceReconciler;
import com.flagship.wallet_ledger.audit.TrialBalanceAuditor;
import com.flagship.wallet_ledger.audit.TrialBalanceStatus;
import com.flagship.wallet_ledger.ledger.context.ChargeContext;
import com.flagship.wallet_ledger.ledger.context.ReversalContext;
import com.flagship.wallet_ledger.ledger.context.TopupContext;
import com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.ledger.exception.LedgerException;
import com.flagship.wallet_ledger.ledger.exception.ReversalAlreadyExistsException;
import com.flagship.wallet_ledger.ledger.exception.ReversalForbiddenTypeException;
import com.flagship.wallet_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.outbox.LedgerTransactionPostedEvent;
import com.flagship.wallet_ledger.outbox.OutboxEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ledger behavior against PostgreSQL: every operation must leave the books balanced,
 * customer credits non-negative and nothing half-written behind.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class LedgerServiceIntegrationTest {

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
    private LedgerService ledgerService;

    @Autowired
    private AccountBalanceStore balanceStore;

    @Autowired
    private TrialBalanceAuditor trialBalanceAuditor;

    @Autowired
    private BalanceReconciler balanceReconciler;

    @Autowired
    private OutboxService outboxService;

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

    private long balance(UUID user) {
        return ledgerService.getBalance(user).getBalanceMinor();
    }

    private void assertBooksBalanced() {
        assertEquals(TrialBalanceStatus.OK, trialBalanceAuditor.run().getStatus(), "trial balance");
        assertTrue(balanceReconciler.reconcile().isEmpty(), "running balances match entries");
    }

    private int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Topup, charge, bonus and reversal of the charge move the balance as expected")
    void walletLifecycle() {
        ledgerService.topup(userId, 10000, "init");
        assertEquals(10000, balance(userId));
        assertBooksBalanced();

        UUID chargeId = ledgerService.charge(userId, 3000, "coffee");
        assertEquals(7000, balance(userId));
        assertBooksBalanced();

        ledgerService.bonus(userId, 500, "loyalty");
        assertEquals(7500, balance(userId));
        assertBooksBalanced();

        UUID reversalId = ledgerService.reversal(chargeId);
        assertEquals(10500, balance(userId));
        assertBooksBalanced();

        assertEquals(10000, balanceStore.getBalance(AccountCode.CASH_CLEARING, null));
        assertEquals(0, balanceStore.getBalance(AccountCode.SALES_REVENUE, null));
        assertEquals(500, balanceStore.getBalance(AccountCode.MARKETING_EXPENSE, null));

        TransactionWithEntries reversal = ledgerService.getTransaction(reversalId);
        assertEquals(LedgerTransactionType.REVERSAL, reversal.getTransaction().getType());
        assertEquals(chargeId, reversal.getTransaction().getReversalOf());
        assertEquals(new ReversalContext(chargeId), reversal.getTransaction().getContext());
    }

    @Test
    @DisplayName("Charging more than the balance fails and leaves nothing behind")
    void chargeWithoutFundsLeavesNoTrace() {
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> ledgerService.charge(userId, 100, "x"));

        assertEquals(0, e.getBalanceMinor());
        assertEquals(100, e.getRequiredMinor());
        assertEquals(0, balance(userId));
        assertEquals(0, count("ledger_transactions"));
        assertEquals(0, count("ledger_entries"));
        assertEquals(0, count("outbox_events"));
        assertEquals(0, balanceStore.getBalance(AccountCode.SALES_REVENUE, null));
    }

    @Test
    @DisplayName("A failed charge rolls back completely and earlier postings stay intact")
    void failedChargeDoesNotTouchEarlierPostings() {
        ledgerService.topup(userId, 500, null);

        assertThrows(InsufficientFundsException.class, () -> ledgerService.charge(userId, 501, null));

        assertEquals(500, balance(userId));
        assertEquals(1, count("ledger_transactions"));
        assertEquals(2, count("ledger_entries"));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("Every transaction is stored with one debit and one credit of the same amount")
    void transactionsAreBalanced() {
        UUID topupId = ledgerService.topup(userId, 1200, "card");

        TransactionWithEntries topup = ledgerService.getTransaction(topupId);

        assertEquals(2, topup.getEntries().size());
        LedgerEntry debit = topup.getEntries().get(0);
        LedgerEntry credit = topup.getEntries().get(1);
        assertEquals(EntrySide.DEBIT, debit.getSide());
        assertEquals(AccountCode.CASH_CLEARING, debit.getAccountCode());
        assertNull(debit.getUserId());
        assertEquals(EntrySide.CREDIT, credit.getSide());
        assertEquals(AccountCode.CUSTOMER_CREDITS, credit.getAccountCode());
        assertEquals(userId, credit.getUserId());
        assertEquals(debit.getAmountMinor(), credit.getAmountMinor());
        assertEquals(new TopupContext("card"), topup.getTransaction().getContext());
    }

    @Test
    @DisplayName("Reading a transaction twice gives the same result")
    void readsAreRepeatable() {
        UUID txId = ledgerService.topup(userId, 700, null);

        assertEquals(ledgerService.getTransaction(txId), ledgerService.getTransaction(txId));
    }

    @Test
    @DisplayName("Unknown transactions are not found")
    void unknownTransaction() {
        UUID unknown = UUID.randomUUID();

        assertThrows(TransactionNotFoundException.class, () -> ledgerService.getTransaction(unknown));
        assertThrows(TransactionNotFoundException.class, () -> ledgerService.reversal(unknown));
    }

    @Test
    @DisplayName("Reversing a transaction restores every balance it touched")
    void reversalRestoresBalances() {
        ledgerService.topup(userId, 2000, null);
        UUID bonusId = ledgerService.bonus(userId, 300, "referral");

        ledgerService.reversal(bonusId);

        assertEquals(2000, balance(userId));
        assertEquals(2000, balanceStore.getBalance(AccountCode.CASH_CLEARING, null));
        assertEquals(0, balanceStore.getBalance(AccountCode.MARKETING_EXPENSE, null));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("Reversing an unspent topup returns cash clearing and customer credits to where they were")
    void topupReversalRoundTrip() {
        ledgerService.topup(userId, 700, "earlier");
        long cashBefore = balanceStore.getBalance(AccountCode.CASH_CLEARING, null);
        long creditsBefore = balance(userId);
        UUID topupId = ledgerService.topup(userId, 500, "counter");

        UUID reversalId = ledgerService.reversal(topupId);

        assertEquals(creditsBefore, balance(userId));
        assertEquals(cashBefore, balanceStore.getBalance(AccountCode.CASH_CLEARING, null));
        TransactionWithEntries reversal = ledgerService.getTransaction(reversalId);
        assertEquals(topupId, reversal.getTransaction().getReversalOf());
        assertEquals(new ReversalContext(topupId), reversal.getTransaction().getContext());
        assertEquals(3, count("ledger_transactions"));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("A transaction can be reversed only once and a reversal cannot be reversed")
    void reversalRules() {
        ledgerService.topup(userId, 1000, null);
        UUID chargeId = ledgerService.charge(userId, 400, null);
        UUID reversalId = ledgerService.reversal(chargeId);

        ReversalAlreadyExistsException again = assertThrows(ReversalAlreadyExistsException.class,
            () -> ledgerService.reversal(chargeId));
        assertEquals(chargeId, again.getOriginalTxId());
        assertThrows(ReversalForbiddenTypeException.class, () -> ledgerService.reversal(reversalId));

        assertEquals(1000, balance(userId));
        assertEquals(3, count("ledger_transactions"));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("Reversing a topup whose credits were spent fails with insufficient funds")
    void reversalOfSpentTopup() {
        UUID topupId = ledgerService.topup(userId, 1000, null);
        ledgerService.charge(userId, 800, null);

        assertThrows(InsufficientFundsException.class, () -> ledgerService.reversal(topupId));

        assertEquals(200, balance(userId));
        assertEquals(2, count("ledger_transactions"));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("Concurrent charges never overdraw the customer")
    void concurrentChargesNeverOverdraw() throws Exception {
        ledgerService.topup(userId, 1000, null);

        List<Callable<UUID>> charges = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            charges.add(() -> ledgerService.charge(userId, 300, null));
        }
        List<Throwable> failures = runConcurrently(charges);

        long rejected = failures.stream().filter(InsufficientFundsException.class::isInstance).count();
        assertEquals(failures.size(), rejected, "only insufficient funds failures expected");
        assertEquals(7, rejected);
        assertEquals(100, balance(userId));
        assertEquals(900, balanceStore.getBalance(AccountCode.SALES_REVENUE, null));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("Concurrent reversals of the same transaction produce exactly one reversal")
    void concurrentReversalsProduceOne() throws Exception {
        ledgerService.topup(userId, 1000, null);
        UUID chargeId = ledgerService.charge(userId, 250, null);

        List<Callable<UUID>> reversals = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            reversals.add(() -> ledgerService.reversal(chargeId));
        }
        List<Throwable> failures = runConcurrently(reversals);

        assertEquals(7, failures.size());
        assertTrue(failures.stream().allMatch(ReversalAlreadyExistsException.class::isInstance),
            "losers must see ReversalAlreadyExists, got " + failures);
        Integer reversalCount = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE reversal_of = ?", Integer.class, chargeId);
        assertEquals(1, reversalCount);
        assertEquals(1000, balance(userId));
        assertBooksBalanced();
    }

    @Test
    @DisplayName("History pages newest first without gaps or duplicates")
    void historyPagination() {
        List<UUID> posted = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            posted.add(ledgerService.topup(userId, i * 100L, "topup " + i));
        }
        UUID otherUser = UUID.randomUUID();
        ledgerService.topup(otherUser, 999, null);

        TransactionPage first = ledgerService.getTransactions(userId, 2, null);
        TransactionPage second = ledgerService.getTransactions(userId, 2, first.getNextCursor());
        TransactionPage third = ledgerService.getTransactions(userId, 2, second.getNextCursor());

        assertTrue(first.isHasMore());
        assertTrue(second.isHasMore());
        assertFalse(third.isHasMore());
        assertNull(third.getNextCursor());

        List<UUID> seen = new ArrayList<>();
        for (TransactionPage page : List.of(first, second, third)) {
            page.getTransactions().forEach(tx -> seen.add(tx.getId()));
        }
        assertEquals(5, seen.size());
        assertEquals(5, new HashSet<>(seen).size());
        assertEquals(posted.get(4), seen.get(0));
        assertEquals(posted.get(0), seen.get(4));
    }

    @Test
    @DisplayName("History includes charges and reversals touching the user's credits")
    void historyIncludesAllTypes() {
        ledgerService.topup(userId, 1000, null);
        UUID chargeId = ledgerService.charge(userId, 100, "muffin");
        ledgerService.reversal(chargeId);

        TransactionPage page = ledgerService.getTransactions(userId, null, null);

        assertEquals(3, page.getTransactions().size());
        assertFalse(page.isHasMore());
        assertEquals(LedgerTransactionType.REVERSAL, page.getTransactions().get(0).getType());
        assertEquals(new ChargeContext("muffin"), page.getTransactions().get(1).getContext());
    }

    @Test
    @DisplayName("Each committed transaction writes exactly one outbox event")
    void committedTransactionsAreInOutbox() throws Exception {
        UUID topupId = ledgerService.topup(userId, 1000, null);
        UUID chargeId = ledgerService.charge(userId, 200, null);
        assertThrows(InsufficientFundsException.class, () -> ledgerService.charge(userId, 5000, null));

        List<OutboxEvent> topupEvents = outboxService.getEventsForTransaction(topupId);
        assertEquals(1, topupEvents.size());
        assertEquals(LedgerTransactionPostedEvent.EVENT_TYPE, topupEvents.get(0).getEventType());
        JsonNode payload = objectMapper.readTree(topupEvents.get(0).getPayload());
        assertEquals("topup", payload.get("type").asText());
        assertEquals(topupId.toString(), payload.get("txId").asText());
        assertEquals(2, payload.get("entries").size());
        assertFalse(topupEvents.get(0).isPublished());

        assertEquals(1, outboxService.getEventsForTransaction(chargeId).size());
        assertEquals(2, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Storage constraints reject a negative customer balance even outside the service")
    void databaseRejectsNegativeCustomerBalance() {
        ledgerService.topup(userId, 100, null);

        assertThrows(Exception.class, () -> jdbcTemplate.update(
            "UPDATE account_balances SET balance_minor = -1 WHERE account_code = 2000 AND user_id = ?", userId));
        assertEquals(100, balance(userId));
    }

    private static List<Throwable> runConcurrently(List<Callable<UUID>> tasks) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UUID>> futures = new ArrayList<>();
            for (Callable<UUID> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();

            List<Throwable> failures = new ArrayList<>();
            Set<UUID> committed = new HashSet<>();
            for (Future<UUID> future : futures) {
                try {
                    committed.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                } catch (TimeoutException e) {
                    fail("operation did not finish in time");
                }
            }
            assertEquals(tasks.size() - failures.size(), committed.size());
            for (Throwable failure : failures) {
                assertInstanceOf(LedgerException.class, failure, "unexpected failure " + failure);
            }
            return failures;
        } finally {
            pool.shutdownNow();
        }
    }
}
