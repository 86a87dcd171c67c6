package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountBalanceStore;
import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.ledger.context.BonusContext;
import com.flagship.wallet_ledger.ledger.context.ChargeContext;
import com.flagship.wallet_ledger.ledger.context.TopupContext;
import com.flagship.wallet_ledger.ledger.exception.LedgerException;
import com.flagship.wallet_ledger.ledger.exception.ReversalAlreadyExistsException;
import com.flagship.wallet_ledger.ledger.exception.ReversalForbiddenTypeException;
import com.flagship.wallet_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.ledger.exception.ValidationFailedException;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the ledger: the four write operations and the customer-facing reads.
 *
 * Each write builds a balanced posting for its transaction type and hands it to
 * {@link LedgerPostingExecutor}. Account mapping per type:
 *
 * <pre>
 * topup    debit 1000         credit 2000(user)   deltas 1000 +a, 2000(user) +a
 * charge   debit 2000(user)   credit 4000         deltas 2000(user) -a, 4000 +a
 * bonus    debit 5000         credit 2000(user)   deltas 5000 +a, 2000(user) +a
 * reversal original entries with sides swapped, inverse deltas
 * </pre>
 *
 * Writes return the new transaction id once it is committed. Callers that need
 * idempotent retries must deduplicate before calling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String MDC_TX_ID = "txId";
    private static final String MDC_USER_ID = "userId";

    private final LedgerPostingExecutor executor;
    private final TransactionLog transactionLog;
    private final AccountBalanceStore balanceStore;
    private final ReversalPlanner reversalPlanner;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Customer buys credits: cash arrives in clearing, the customer's credit grows.
     */
    @Transactional
    public UUID topup(UUID userId, long amountMinor, String note) {
        return post(LedgerTransactionType.TOPUP, userId, () -> {
            requireId(userId, "userId");
            requirePositive(amountMinor);
            return Posting.of(new TopupContext(note),
                List.of(
                    PostingLeg.debit(AccountCode.CASH_CLEARING, null, amountMinor),
                    PostingLeg.credit(AccountCode.CUSTOMER_CREDITS, userId, amountMinor)),
                List.of(
                    BalanceDelta.global(AccountCode.CASH_CLEARING, amountMinor),
                    BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, amountMinor)));
        });
    }

    /**
     * Point-of-sale purchase paid with credits.
     *
     * @throws com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException
     *         if the customer's committed balance is below the amount
     */
    @Transactional
    public UUID charge(UUID userId, long amountMinor, String note) {
        return post(LedgerTransactionType.CHARGE, userId, () -> {
            requireId(userId, "userId");
            requirePositive(amountMinor);
            return Posting.of(new ChargeContext(note),
                List.of(
                    PostingLeg.debit(AccountCode.CUSTOMER_CREDITS, userId, amountMinor),
                    PostingLeg.credit(AccountCode.SALES_REVENUE, null, amountMinor)),
                List.of(
                    BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, -amountMinor),
                    BalanceDelta.global(AccountCode.SALES_REVENUE, amountMinor)));
        });
    }

    /**
     * Loyalty credits granted by the café, booked as marketing expense.
     */
    @Transactional
    public UUID bonus(UUID userId, long amountMinor, String reason) {
        return post(LedgerTransactionType.BONUS, userId, () -> {
            requireId(userId, "userId");
            requirePositive(amountMinor);
            if (reason == null) {
                throw new ValidationFailedException("Bonus reason is required");
            }
            return Posting.of(new BonusContext(reason),
                List.of(
                    PostingLeg.debit(AccountCode.MARKETING_EXPENSE, null, amountMinor),
                    PostingLeg.credit(AccountCode.CUSTOMER_CREDITS, userId, amountMinor)),
                List.of(
                    BalanceDelta.global(AccountCode.MARKETING_EXPENSE, amountMinor),
                    BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, amountMinor)));
        });
    }

    /**
     * Undoes a topup, charge or bonus. A transaction can be reversed at most once,
     * and reversals themselves cannot be reversed.
     *
     * Reversing a topup or bonus debits the customer's credits and fails with
     * InsufficientFunds if they were already spent.
     */
    @Transactional
    public UUID reversal(UUID txId) {
        return post(LedgerTransactionType.REVERSAL, null, () -> {
            requireId(txId, "txId");
            TransactionWithEntries original = transactionLog.getTransaction(txId)
                .orElseThrow(() -> new TransactionNotFoundException(txId));

            if (original.getTransaction().isReversal()) {
                throw new ReversalForbiddenTypeException(txId);
            }
            if (transactionLog.findReversalOf(txId).isPresent()) {
                throw new ReversalAlreadyExistsException(txId);
            }

            return Posting.reversal(txId,
                reversalPlanner.mirrorLegs(original),
                reversalPlanner.inverseDeltas(original));
        });
    }

    /**
     * Customer credit balance. Unknown users have a zero balance as of now.
     */
    @Transactional(readOnly = true)
    public BalanceView getBalance(UUID userId) {
        requireId(userId, "userId");
        return balanceStore.findBalance(AccountCode.CUSTOMER_CREDITS, userId)
            .map(balance -> new BalanceView(userId, balance.getBalanceMinor(), balance.getUpdatedAt()))
            .orElseGet(() -> new BalanceView(userId, 0L, clock.instant()));
    }

    @Transactional(readOnly = true)
    public TransactionWithEntries getTransaction(UUID txId) {
        requireId(txId, "txId");
        return transactionLog.getTransaction(txId)
            .orElseThrow(() -> new TransactionNotFoundException(txId));
    }

    /**
     * One page of the user's history, newest first.
     *
     * @param limit  page size, defaults to ledger.transactions.default-limit
     * @param cursor nextCursor of the previous page, or null for the first page
     */
    @Transactional(readOnly = true)
    public TransactionPage getTransactions(UUID userId, Integer limit, String cursor) {
        requireId(userId, "userId");
        int maxLimit = properties.getTransactions().getMaxLimit();
        int pageSize = limit != null ? limit : properties.getTransactions().getDefaultLimit();
        if (pageSize < 1 || pageSize > maxLimit) {
            throw new ValidationFailedException("Limit must be between 1 and " + maxLimit + ", got " + pageSize);
        }
        TransactionCursor position = cursor == null || cursor.isEmpty() ? null : TransactionCursor.decode(cursor);
        return transactionLog.getTransactionsForUser(userId, pageSize, position);
    }

    private UUID post(LedgerTransactionType type, UUID userId, Supplier<Posting> planner) {
        String operation = type.dbValue();
        long startTime = System.currentTimeMillis();
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }

        try {
            if (!properties.isEnabled()) {
                throw new ValidationFailedException("Ledger is disabled");
            }

            TransactionWithEntries posted = executor.execute(planner.get());
            MDC.put(MDC_TX_ID, posted.getTxId().toString());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            log.info("Posted {} transaction: amount={}, reversalOf={}, duration={}ms",
                operation, posted.getEntries().get(0).getAmountMinor(),
                posted.getTransaction().getReversalOf(), duration);
            return posted.getTxId();

        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getCode().name());
            if (e.isRecoverable()) {
                log.warn("Rejected {} operation: code={}, reason={}", operation, e.getCode(), e.getMessage());
            } else {
                log.error("Ledger invariant broken during {}: {}", operation, e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("{} operation failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(MDC_TX_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    private static void requireId(UUID id, String name) {
        if (id == null) {
            throw new ValidationFailedException(name + " is required");
        }
    }

    private static void requirePositive(long amountMinor) {
        if (amountMinor <= 0) {
            throw new ValidationFailedException("Amount must be positive, got " + amountMinor);
        }
    }
}
