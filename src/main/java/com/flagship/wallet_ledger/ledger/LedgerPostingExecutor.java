package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountBalanceStore;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records one posting atomically.
 *
 * Inside a single database transaction:
 * 1. Validates the posting shape (nothing is written if it is malformed)
 * 2. Appends the header and both entries
 * 3. Applies every balance delta (the customer credit check happens here)
 * 4. Writes the LedgerTransactionPosted event to the outbox
 *
 * Any failure rolls back all four steps, so no partial transaction is ever visible.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingExecutor {

    private final PostingValidator validator;
    private final TransactionLog transactionLog;
    private final AccountBalanceStore balanceStore;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Transactional
    public TransactionWithEntries execute(Posting posting) {
        try {
            validator.validate(posting);
        } catch (LedgerInvariantBrokenException e) {
            log.error("Rejected malformed {} posting: {}", posting.getType().dbValue(), e.getMessage());
            metrics.recordInvariantBroken(posting.getType().dbValue());
            throw e;
        }

        TransactionWithEntries posted = transactionLog.append(
            posting.getType(), posting.getContext(), posting.getReversalOf(), posting.getLegs());

        for (BalanceDelta delta : posting.getDeltas()) {
            balanceStore.applyDelta(delta.getAccountCode(), delta.getUserId(), delta.getDelta());
        }

        outboxService.recordPosted(posted);
        return posted;
    }
}
