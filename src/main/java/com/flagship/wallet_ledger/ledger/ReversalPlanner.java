package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;
import com.flagship.wallet_ledger.ledger.exception.ReversalForbiddenTypeException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds the inverse of a recorded transaction from its type and its two entries.
 *
 * No undo plan is stored. Adding a transaction type without a case here fails compilation,
 * because the switch over {@link LedgerTransactionType} has no default branch.
 */
@Component
public class ReversalPlanner {

    /**
     * Entries of the reversal: the originals with debit and credit swapped.
     */
    public List<PostingLeg> mirrorLegs(TransactionWithEntries original) {
        return original.getEntries().stream()
            .map(LedgerEntry::mirror)
            .toList();
    }

    /**
     * Balance deltas that undo the original transaction.
     *
     * @throws ReversalForbiddenTypeException if the original is itself a reversal
     */
    public List<BalanceDelta> inverseDeltas(TransactionWithEntries original) {
        LedgerTransaction tx = original.getTransaction();
        if (tx.isReversal()) {
            throw new ReversalForbiddenTypeException(tx.getId());
        }

        long amount = amountOf(original);
        UUID userId = customerOf(original);

        return switch (tx.getType()) {
            case TOPUP -> List.of(
                BalanceDelta.global(AccountCode.CASH_CLEARING, -amount),
                BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, -amount));
            case CHARGE -> List.of(
                BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, amount),
                BalanceDelta.global(AccountCode.SALES_REVENUE, -amount));
            case BONUS -> List.of(
                BalanceDelta.global(AccountCode.MARKETING_EXPENSE, -amount),
                BalanceDelta.of(AccountCode.CUSTOMER_CREDITS, userId, -amount));
            case REVERSAL -> throw new ReversalForbiddenTypeException(tx.getId());
        };
    }

    private static long amountOf(TransactionWithEntries original) {
        List<LedgerEntry> entries = original.getEntries();
        if (entries.size() != 2 || entries.get(0).getAmountMinor() != entries.get(1).getAmountMinor()) {
            throw new LedgerInvariantBrokenException(
                "Stored transaction " + original.getTxId() + " does not have two balanced entries");
        }
        return entries.get(0).getAmountMinor();
    }

    private static UUID customerOf(TransactionWithEntries original) {
        return original.getEntries().stream()
            .filter(entry -> entry.getAccountCode() == AccountCode.CUSTOMER_CREDITS)
            .map(LedgerEntry::getUserId)
            .findFirst()
            .orElseThrow(() -> new LedgerInvariantBrokenException(
                "Stored transaction " + original.getTxId() + " has no customer credit entry"));
    }
}
