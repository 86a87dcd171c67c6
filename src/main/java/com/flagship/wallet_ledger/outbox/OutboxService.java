package com.flagship.wallet_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.TransactionWithEntries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox and tracks their publication.
 *
 * Events are never sent to Kafka from here; OutboxPublisher does that after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Records that a ledger transaction was posted.
     * Must run inside the posting's own database transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent recordPosted(TransactionWithEntries posted) {
        LedgerTransactionPostedEvent event = LedgerTransactionPostedEvent.from(posted);
        OutboxEvent outboxEvent = OutboxEvent.create(
            LedgerTransactionPostedEvent.AGGREGATE_TYPE,
            posted.getTxId(),
            LedgerTransactionPostedEvent.EVENT_TYPE,
            serializePayload(event));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));
        log.debug("Saved outbox event {} for transaction {}", saved.getId(), posted.getTxId());
        return saved.toDomain();
    }

    /**
     * Locks a batch of unpublished events that have retries left (SELECT FOR UPDATE SKIP LOCKED).
     * The row locks last until the caller's transaction ends, so the caller must send and mark
     * the batch inside that same transaction.
     */
    @Transactional
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed send and returns the event's new retry count (0 if the event is gone).
     */
    @Transactional
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForTransaction(UUID txId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                LedgerTransactionPostedEvent.AGGREGATE_TYPE, txId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
