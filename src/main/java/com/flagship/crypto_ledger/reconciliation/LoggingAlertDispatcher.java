package com.flagship.crypto_ledger.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes alerts to the log. Used when Kafka publication is switched off.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.alerts.kafka.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingAlertDispatcher implements AlertDispatcher {

    @Override
    public void sendBatchAlert(List<ReconciliationAlert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return;
        }
        for (ReconciliationAlert alert : alerts) {
            log.warn("Reconciliation alert [{}]: wallet={}, asset={}, variance={}, variancePercent={}%, message={}",
                    alert.getSeverity(), alert.getWalletAddress(), alert.getAsset(),
                    alert.getVariance().toPlainString(), alert.getVariancePercent().toPlainString(),
                    alert.getMessage());
        }
    }
}
