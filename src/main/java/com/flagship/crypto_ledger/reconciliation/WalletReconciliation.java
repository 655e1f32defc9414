package com.flagship.crypto_ledger.reconciliation;

import com.flagship.crypto_ledger.ledger.BookBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Current reconciliation state of one wallet-asset pair.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - State changes are immutable (each transition returns a new instance)
 * - alertSent latches false to true when an alert goes out, and only clears when
 *   a run finds the pair within threshold or an operator resolves it
 */
@Value
@Builder(toBuilder = true)
public class WalletReconciliation {
    UUID id;
    UUID walletAccountId;
    String address;
    String asset;
    BigDecimal onChainBalance;
    Long onChainBlockNumber;
    Instant onChainTimestamp;
    BigDecimal bookBalance;
    LocalDate bookAsOfDate;
    int postingCount;
    BigDecimal variance;
    BigDecimal variancePercent;
    BigDecimal threshold;
    boolean withinThreshold;
    AlertSeverity severity;
    ReconciliationStatus status;
    boolean alertSent;
    Instant alertSentAt;
    String resolution;
    String resolvedBy;
    Instant resolvedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A pair that has never been reconciled.
     */
    public static WalletReconciliation pending(UUID walletAccountId, String address, String asset) {
        Instant now = Instant.now();
        return WalletReconciliation.builder()
            .id(UUID.randomUUID())
            .walletAccountId(walletAccountId)
            .address(address)
            .asset(asset)
            .status(ReconciliationStatus.PENDING)
            .alertSent(false)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Starts a new run: the pair goes back to PENDING until the measurement is recorded.
     */
    public WalletReconciliation startRun() {
        return toBuilder()
            .status(ReconciliationStatus.PENDING)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Records a run's measurement and ends the run.
     *
     * Within threshold: RECONCILED and the alert latch clears.
     * Out of threshold: ALERTED if an alert already went out for this condition, else FLAGGED.
     *
     * @throws IllegalStateException if the pair is not PENDING
     */
    public WalletReconciliation record(OnChainBalance onChain, BookBalance book,
                                       VarianceAssessment assessment, BigDecimal threshold) {
        if (this.status != ReconciliationStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot record a run for %s/%s in %s status. Call startRun first.", walletAccountId, asset, status));
        }

        ReconciliationStatus outcome;
        if (assessment.isWithinThreshold()) {
            outcome = ReconciliationStatus.RECONCILED;
        } else {
            outcome = this.alertSent ? ReconciliationStatus.ALERTED : ReconciliationStatus.FLAGGED;
        }
        boolean latch = !assessment.isWithinThreshold() && this.alertSent;

        return toBuilder()
            .onChainBalance(onChain.getBalance())
            .onChainBlockNumber(onChain.getBlockNumber())
            .onChainTimestamp(onChain.getTimestamp())
            .bookBalance(book.getBalance())
            .bookAsOfDate(book.getAsOfDate())
            .postingCount(book.getPostingCount())
            .variance(assessment.getVariance())
            .variancePercent(assessment.getVariancePercent())
            .threshold(threshold)
            .withinThreshold(assessment.isWithinThreshold())
            .severity(assessment.getSeverity())
            .status(outcome)
            .alertSent(latch)
            .alertSentAt(latch ? this.alertSentAt : null)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * True when an alert should go out for the current measurement.
     */
    public boolean isAlertDue(VarianceAssessment assessment) {
        return status == ReconciliationStatus.FLAGGED && !alertSent && assessment.isAlertWorthy();
    }

    /**
     * Sets the alert latch after a successful dispatch.
     *
     * @throws IllegalStateException if the pair is not FLAGGED or was already alerted
     */
    public WalletReconciliation markAlerted(Instant sentAt) {
        if (this.status != ReconciliationStatus.FLAGGED || this.alertSent) {
            throw new IllegalStateException(String.format(
                "Cannot mark %s/%s alerted in %s status (alertSent=%s).", walletAccountId, asset, status, alertSent));
        }
        return toBuilder()
            .status(ReconciliationStatus.ALERTED)
            .alertSent(true)
            .alertSentAt(sentAt)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Operator sign-off. Clears the alert latch, so the next run alerts again if the variance persists.
     */
    public WalletReconciliation resolve(String resolvedBy, String resolution) {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolvedBy is required");
        }
        Instant now = Instant.now();
        return toBuilder()
            .status(ReconciliationStatus.RECONCILED)
            .alertSent(false)
            .alertSentAt(null)
            .resolvedBy(resolvedBy)
            .resolution(resolution)
            .resolvedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Out of threshold and not signed off.
     */
    public boolean isUnreconciled() {
        return !withinThreshold
            && (status == ReconciliationStatus.FLAGGED || status == ReconciliationStatus.ALERTED);
    }
}
