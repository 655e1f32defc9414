package com.flagship.crypto_ledger.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletReconciliationRepository extends JpaRepository<WalletReconciliationEntity, UUID> {

    Optional<WalletReconciliationEntity> findByWalletAccountIdAndAsset(UUID walletAccountId, String asset);

    List<WalletReconciliationEntity> findByWalletAccountIdOrderByAssetAsc(UUID walletAccountId);

    /**
     * Pairs out of threshold in one of the given statuses.
     */
    @Query("SELECT r FROM WalletReconciliationEntity r WHERE r.withinThreshold = false AND r.status IN :statuses")
    List<WalletReconciliationEntity> findOutOfThreshold(@Param("statuses") Collection<ReconciliationStatus> statuses);

    /**
     * Sets the alert latch on a FLAGGED pair whose latch is still clear.
     *
     * @return 1 if this call set the latch, 0 if another run already had
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WalletReconciliationEntity r SET r.alertSent = true, r.alertSentAt = :sentAt, " +
           "r.status = com.flagship.crypto_ledger.reconciliation.ReconciliationStatus.ALERTED, r.updatedAt = :sentAt " +
           "WHERE r.id = :id AND r.alertSent = false " +
           "AND r.status = com.flagship.crypto_ledger.reconciliation.ReconciliationStatus.FLAGGED")
    int claimAlert(@Param("id") UUID id, @Param("sentAt") Instant sentAt);

    /**
     * Undoes {@link #claimAlert} after a failed dispatch, only if the latch is still the one set at {@code sentAt}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WalletReconciliationEntity r SET r.alertSent = false, r.alertSentAt = null, " +
           "r.status = com.flagship.crypto_ledger.reconciliation.ReconciliationStatus.FLAGGED, r.updatedAt = :releasedAt " +
           "WHERE r.id = :id AND r.alertSent = true AND r.alertSentAt = :sentAt")
    int releaseAlert(@Param("id") UUID id, @Param("sentAt") Instant sentAt, @Param("releasedAt") Instant releasedAt);

    @Query("SELECT COUNT(r) FROM WalletReconciliationEntity r WHERE r.withinThreshold = false AND r.status IN :statuses")
    long countOutOfThreshold(@Param("statuses") Collection<ReconciliationStatus> statuses);
}
