package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for committed ledger transactions.
 *
 * Only declared when the outbox publisher runs, so a ledger without a broker starts cleanly.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger:ledger-transactions}")
    private String ledgerTopic;

    /**
     * Keyed by transaction id, so 3 partitions keep per-transaction ordering.
     */
    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
