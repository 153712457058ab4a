package com.flagship.pharmacy_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the ledger.
 *
 * Stock and cash events are keyed by entity key (batch or account), so three partitions
 * keep per-entity ordering while letting unrelated entities spread out.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.stock-events:ledger.stock-events}")
    private String stockEventsTopic;

    @Value("${kafka.topic.cash-events:ledger.cash-events}")
    private String cashEventsTopic;

    @Value("${kafka.topic.intake:ledger.intake}")
    private String intakeTopic;

    @Bean
    public NewTopic stockEventsTopic() {
        return TopicBuilder.name(stockEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic cashEventsTopic() {
        return TopicBuilder.name(cashEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic intakeTopic() {
        return TopicBuilder.name(intakeTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
