package com.flagship.crypto_ledger.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes reconciliation alerts as JSON to Kafka.
 *
 * Uses the wallet account ID as the record key so one wallet's alerts land on one
 * partition in order. Waits for every acknowledgment before returning, so the
 * caller only latches alertSent once the broker has the batch.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.alerts.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaAlertDispatcher implements AlertDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.reconciliation-alerts:reconciliation-alerts}")
    private String alertsTopic;

    @Value("${reconciliation.alerts.kafka.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Override
    public void sendBatchAlert(List<ReconciliationAlert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return;
        }

        List<CompletableFuture<SendResult<String, String>>> futures = new ArrayList<>(alerts.size());
        for (ReconciliationAlert alert : alerts) {
            futures.add(kafkaTemplate.send(alertsTopic, alert.getWalletAccountId().toString(), toJson(alert)));
        }

        try {
            for (CompletableFuture<SendResult<String, String>> future : futures) {
                SendResult<String, String> result = future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
                log.debug("Published alert: topic={}, partition={}, offset={}",
                        result.getRecordMetadata().topic(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDispatchException("Interrupted while publishing reconciliation alerts", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AlertDispatchException("Failed to publish reconciliation alerts to " + alertsTopic, e);
        }

        log.info("Published {} reconciliation alerts to {}", alerts.size(), alertsTopic);
    }

    private String toJson(ReconciliationAlert alert) {
        try {
            return objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new AlertDispatchException("Failed to serialize reconciliation alert", e);
        }
    }
}
