package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.context.ReversalContext;
import com.flagship.wallet_ledger.ledger.context.TransactionContext;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Everything the posting executor needs to record one transaction:
 * the header data, the two legs and the balance deltas they imply.
 */
@Value
public class Posting {
    LedgerTransactionType type;
    TransactionContext context;
    UUID reversalOf;
    List<PostingLeg> legs;
    List<BalanceDelta> deltas;

    public static Posting of(TransactionContext context, List<PostingLeg> legs, List<BalanceDelta> deltas) {
        return new Posting(context.type(), context, null, List.copyOf(legs), List.copyOf(deltas));
    }

    public static Posting reversal(UUID originalTxId, List<PostingLeg> legs, List<BalanceDelta> deltas) {
        return new Posting(LedgerTransactionType.REVERSAL, new ReversalContext(originalTxId),
            originalTxId, List.copyOf(legs), List.copyOf(deltas));
    }
}
