package com.flagship.crypto_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for reconciliation alerts.
 *
 * Only active when alert publication to Kafka is switched on; otherwise
 * alerts go to the log and no broker is needed.
 */
@Configuration
@ConditionalOnProperty(name = "reconciliation.alerts.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.reconciliation-alerts:reconciliation-alerts}")
    private String alertsTopic;

    /**
     * Creates the alerts topic if it doesn't exist.
     * Keyed by wallet, so one wallet's alerts stay ordered.
     */
    @Bean
    public NewTopic reconciliationAlertsTopic() {
        return TopicBuilder.name(alertsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
