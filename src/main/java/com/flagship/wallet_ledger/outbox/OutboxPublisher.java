package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Each poll runs in one database transaction, so the batch's row locks are held until every
 * event in it has been sent and marked. Sends are synchronous and keyed by transaction id.
 * A failed send increments the event's retry count; the failure that reaches max-retries
 * dead-letters the event, which is then left in the table for manual handling and no longer polled.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final LedgerMetrics ledgerMetrics;

    @Value("${kafka.topic.ledger:ledger-transactions}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    @Transactional
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished ledger events", events.size());
            events.forEach(this::publishEvent);
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(ledgerTopic, event.getAggregateId().toString(), event.getPayload())
                    .get();

            log.debug("Published event {} to {}-{}@{}", event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            ledgerMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event {}: {}", event.getId(), e.getMessage());
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String errorMessage) {
        int retryCount = outboxService.markFailed(event.getId(), errorMessage);
        ledgerMetrics.recordEventPublishFailed(event.getEventType());
        if (retryCount >= maxRetries) {
            log.warn("Event {} reached max retries ({}), leaving for manual handling. txId={}",
                    event.getId(), maxRetries, event.getAggregateId());
            ledgerMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
