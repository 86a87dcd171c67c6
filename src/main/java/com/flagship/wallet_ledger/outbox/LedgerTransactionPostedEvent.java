package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.TransactionWithEntries;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fact published after a ledger transaction commits.
 *
 * Carries the full posting so consumers (history views, notifications) never
 * need to read the ledger tables directly.
 */
@Value
public class LedgerTransactionPostedEvent {

    public static final String EVENT_TYPE = "LedgerTransactionPosted";
    public static final String AGGREGATE_TYPE = "LedgerTransaction";

    UUID eventId;
    UUID txId;
    String type;
    UUID reversalOf;
    List<Entry> entries;
    Instant createdAt;
    Instant occurredAt;

    public static LedgerTransactionPostedEvent from(TransactionWithEntries posted) {
        LedgerTransaction tx = posted.getTransaction();
        List<Entry> entries = posted.getEntries().stream()
            .map(Entry::from)
            .toList();
        return new LedgerTransactionPostedEvent(UUID.randomUUID(), tx.getId(), tx.getType().dbValue(),
            tx.getReversalOf(), entries, tx.getCreatedAt(), Instant.now());
    }

    @Value
    public static class Entry {
        UUID entryId;
        int accountCode;
        UUID userId;
        String side;
        long amountMinor;

        static Entry from(LedgerEntry entry) {
            return new Entry(entry.getId(), entry.getAccountCode().getCode(), entry.getUserId(),
                entry.getSide().dbValue(), entry.getAmountMinor());
        }
    }
}
