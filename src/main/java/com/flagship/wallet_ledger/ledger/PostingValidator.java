package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.BalanceKey;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the shape of a posting before anything is written.
 *
 * A posting must carry exactly one debit and one credit leg of the same positive amount,
 * each on a correctly scoped account, and a context matching its type. Its balance deltas must
 * be exactly the legs' effects on their accounts. Any violation is a
 * defect in the caller, so it is reported as LedgerInvariantBroken and never corrected.
 */
@Component
public class PostingValidator {

    public void validate(Posting posting) {
        List<PostingLeg> legs = posting.getLegs();
        if (legs.size() != 2) {
            throw new LedgerInvariantBrokenException(
                "Transaction must have exactly 2 entries, got " + legs.size());
        }

        long debits = legs.stream().filter(leg -> leg.getSide() == EntrySide.DEBIT).count();
        long credits = legs.stream().filter(leg -> leg.getSide() == EntrySide.CREDIT).count();
        if (debits != 1 || credits != 1) {
            throw new LedgerInvariantBrokenException(
                "Transaction must have exactly 1 debit and 1 credit entry, got " + debits + " and " + credits);
        }

        long totalDebit = sum(legs, EntrySide.DEBIT);
        long totalCredit = sum(legs, EntrySide.CREDIT);
        if (totalDebit != totalCredit) {
            throw new LedgerInvariantBrokenException(
                String.format("Debit/Credit mismatch: %d != %d", totalDebit, totalCredit));
        }

        for (PostingLeg leg : legs) {
            if (leg.getAmountMinor() <= 0) {
                throw new LedgerInvariantBrokenException("Entry amount must be positive, got " + leg.getAmountMinor());
            }
            if (leg.getAccountCode().isUserScoped() != (leg.getUserId() != null)) {
                throw new LedgerInvariantBrokenException(
                    "Entry on account " + leg.getAccountCode() + " has wrong owner scope");
            }
        }

        if (posting.getContext() == null || posting.getContext().type() != posting.getType()) {
            throw new LedgerInvariantBrokenException("Context does not match transaction type " + posting.getType());
        }
        if ((posting.getType() == LedgerTransactionType.REVERSAL) != (posting.getReversalOf() != null)) {
            throw new LedgerInvariantBrokenException("reversalOf must be set for reversals and only for reversals");
        }

        Map<BalanceKey, Long> expected = new HashMap<>();
        for (PostingLeg leg : legs) {
            expected.merge(new BalanceKey(leg.getAccountCode(), leg.getUserId()),
                leg.getAccountCode().signedAmount(leg.getSide(), leg.getAmountMinor()), Long::sum);
        }
        Map<BalanceKey, Long> actual = new HashMap<>();
        for (BalanceDelta delta : posting.getDeltas()) {
            actual.merge(new BalanceKey(delta.getAccountCode(), delta.getUserId()), delta.getDelta(), Long::sum);
        }
        if (!expected.equals(actual)) {
            throw new LedgerInvariantBrokenException(
                "Balance deltas " + actual + " do not match entries " + expected);
        }
    }

    private static long sum(List<PostingLeg> legs, EntrySide side) {
        return legs.stream()
            .filter(leg -> leg.getSide() == side)
            .mapToLong(PostingLeg::getAmountMinor)
            .sum();
    }
}
