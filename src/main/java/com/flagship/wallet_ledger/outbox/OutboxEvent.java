package com.flagship.wallet_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published.
 *
 * Written in the same database transaction as the posting it describes,
 * so an event exists if and only if the posting committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
