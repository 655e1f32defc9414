package com.flagship.crypto_ledger.reconciliation;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for the per-pair reconciliation state.
 *
 * - No setters: state only changes through {@link #updateFromDomain}
 * - Identity (id, wallet, asset, created_at) is not updatable
 * - One row per wallet-asset pair (unique constraint)
 */
@Entity
@Table(
    name = "wallet_reconciliations",
    uniqueConstraints = @UniqueConstraint(name = "uq_wallet_reconciliations_pair", columnNames = {"wallet_account_id", "asset"}),
    indexes = @Index(name = "idx_wallet_reconciliations_status", columnList = "status")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WalletReconciliationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wallet_account_id", nullable = false, updatable = false)
    private UUID walletAccountId;

    @Column(nullable = false, updatable = false)
    private String address;

    @Column(nullable = false, updatable = false, length = 32)
    private String asset;

    @Column(name = "on_chain_balance", precision = 38, scale = 18)
    private BigDecimal onChainBalance;

    @Column(name = "on_chain_block_number")
    private Long onChainBlockNumber;

    @Column(name = "on_chain_timestamp")
    private Instant onChainTimestamp;

    @Column(name = "book_balance", precision = 38, scale = 18)
    private BigDecimal bookBalance;

    @Column(name = "book_as_of_date")
    private LocalDate bookAsOfDate;

    @Column(name = "posting_count", nullable = false)
    private int postingCount;

    @Column(precision = 38, scale = 18)
    private BigDecimal variance;

    @Column(name = "variance_percent", precision = 38, scale = 8)
    private BigDecimal variancePercent;

    @Column(precision = 38, scale = 18)
    private BigDecimal threshold;

    @Column(name = "within_threshold", nullable = false)
    private boolean withinThreshold;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AlertSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReconciliationStatus status;

    @Column(name = "alert_sent", nullable = false)
    private boolean alertSent;

    @Column(name = "alert_sent_at")
    private Instant alertSentAt;

    @Column
    private String resolution;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create an entity.
     */
    static WalletReconciliationEntity fromDomain(WalletReconciliation reconciliation) {
        return new WalletReconciliationEntity(
            reconciliation.getId(),
            reconciliation.getWalletAccountId(),
            reconciliation.getAddress(),
            reconciliation.getAsset(),
            reconciliation.getOnChainBalance(),
            reconciliation.getOnChainBlockNumber(),
            reconciliation.getOnChainTimestamp(),
            reconciliation.getBookBalance(),
            reconciliation.getBookAsOfDate(),
            reconciliation.getPostingCount(),
            reconciliation.getVariance(),
            reconciliation.getVariancePercent(),
            reconciliation.getThreshold(),
            reconciliation.isWithinThreshold(),
            reconciliation.getSeverity(),
            reconciliation.getStatus(),
            reconciliation.isAlertSent(),
            reconciliation.getAlertSentAt(),
            reconciliation.getResolution(),
            reconciliation.getResolvedBy(),
            reconciliation.getResolvedAt(),
            reconciliation.getCreatedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    public WalletReconciliation toDomain() {
        return new WalletReconciliation(
            id,
            walletAccountId,
            address,
            asset,
            onChainBalance,
            onChainBlockNumber,
            onChainTimestamp,
            bookBalance,
            bookAsOfDate,
            postingCount,
            variance,
            variancePercent,
            threshold,
            withinThreshold,
            severity,
            status,
            alertSent,
            alertSentAt,
            resolution,
            resolvedBy,
            resolvedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable state of a later version of the same pair.
     */
    void updateFromDomain(WalletReconciliation reconciliation) {
        if (!this.id.equals(reconciliation.getId())) {
            throw new IllegalArgumentException(String.format(
                "Reconciliation %s cannot be updated from %s", this.id, reconciliation.getId()));
        }
        this.onChainBalance = reconciliation.getOnChainBalance();
        this.onChainBlockNumber = reconciliation.getOnChainBlockNumber();
        this.onChainTimestamp = reconciliation.getOnChainTimestamp();
        this.bookBalance = reconciliation.getBookBalance();
        this.bookAsOfDate = reconciliation.getBookAsOfDate();
        this.postingCount = reconciliation.getPostingCount();
        this.variance = reconciliation.getVariance();
        this.variancePercent = reconciliation.getVariancePercent();
        this.threshold = reconciliation.getThreshold();
        this.withinThreshold = reconciliation.isWithinThreshold();
        this.severity = reconciliation.getSeverity();
        this.status = reconciliation.getStatus();
        this.alertSent = reconciliation.isAlertSent();
        this.alertSentAt = reconciliation.getAlertSentAt();
        this.resolution = reconciliation.getResolution();
        this.resolvedBy = reconciliation.getResolvedBy();
        this.resolvedAt = reconciliation.getResolvedAt();
    }
}
