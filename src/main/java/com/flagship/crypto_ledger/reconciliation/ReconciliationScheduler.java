package com.flagship.crypto_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Periodic reconciliation of every active wallet.
 *
 * Runs are idempotent: re-running with unchanged balances updates the pair
 * state but sends no new alerts.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationEngine reconciliationEngine;

    @Value("${reconciliation.threshold:0.01}")
    private BigDecimal threshold;

    @Value("${reconciliation.alert-threshold:1}")
    private BigDecimal alertThreshold;

    @Scheduled(cron = "${reconciliation.scheduler.cron:0 0 * * * *}")
    public void reconcileAllWallets() {
        try {
            ReconciliationOptions options = ReconciliationOptions.builder()
                .threshold(threshold)
                .alertThreshold(alertThreshold)
                .build();
            ReconciliationRunSummary summary = reconciliationEngine.reconcileAllWallets(options);

            if (!summary.getFailedWallets().isEmpty()) {
                log.warn("Scheduled reconciliation finished with {} failed wallets: {}",
                        summary.getFailedWallets().size(), summary.getFailedWallets());
            }
        } catch (Exception e) {
            log.error("Scheduled reconciliation run failed: {}", e.getMessage(), e);
        }
    }
}
