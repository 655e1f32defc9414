package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.ledger.ChainVerification;
import com.flagship.crypto_ledger.ledger.HashChainLedger;
import com.flagship.crypto_ledger.reconciliation.WalletReconciliationPersistenceService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Custom health indicators for the crypto ledger.
 */
public class HealthIndicators {

    /**
     * DOWN while appends are halted by a broken hash chain.
     */
    @Component("chainIntegrity")
    public static class ChainIntegrityHealthIndicator implements HealthIndicator {

        private final HashChainLedger ledger;

        public ChainIntegrityHealthIndicator(HashChainLedger ledger) {
            this.ledger = ledger;
        }

        @Override
        public Health health() {
            Optional<ChainVerification> last = ledger.getLastVerification();
            boolean halted = ledger.isHalted();
            Health.Builder builder = halted ? Health.down() : Health.up();
            builder.withDetail("appendsHalted", halted);

            if (last.isEmpty()) {
                return builder.withDetail("lastVerification", "never").build();
            }

            ChainVerification verification = last.get();
            builder.withDetail("lastVerifiedAt", verification.getVerifiedAt().toString())
                    .withDetail("valid", verification.isValid())
                    .withDetail("totalEntries", verification.getTotalEntries());
            if (!verification.isValid()) {
                builder.withDetail("brokenAtEntryId", String.valueOf(verification.getBrokenAtEntryId()))
                        .withDetail("reason", verification.getReason());
            }
            return builder.build();
        }
    }

    /**
     * Number of wallet-asset pairs out of threshold and not yet resolved.
     */
    @Component("reconciliationBacklog")
    public static class ReconciliationBacklogHealthIndicator implements HealthIndicator {

        private final WalletReconciliationPersistenceService persistenceService;
        private static final long BACKLOG_WARNING_THRESHOLD = 10;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 100;

        public ReconciliationBacklogHealthIndicator(WalletReconciliationPersistenceService persistenceService) {
            this.persistenceService = persistenceService;
        }

        @Override
        public Health health() {
            try {
                long unresolved = persistenceService.countUnreconciled();

                Health.Builder builder = unresolved < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : unresolved < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("unresolved", unresolved)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
