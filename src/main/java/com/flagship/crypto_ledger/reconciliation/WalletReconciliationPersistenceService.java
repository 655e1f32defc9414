package com.flagship.crypto_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Bridges {@link WalletReconciliation} and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletReconciliationPersistenceService {

    private static final Set<ReconciliationStatus> UNRESOLVED =
        EnumSet.of(ReconciliationStatus.FLAGGED, ReconciliationStatus.ALERTED);

    private final WalletReconciliationRepository repository;

    /**
     * Inserts the pair on its first run, otherwise updates its mutable state.
     * Existing rows are only changed through the entity's controlled update method.
     */
    @Transactional
    public WalletReconciliation save(WalletReconciliation reconciliation) {
        WalletReconciliationEntity entity = repository.findById(reconciliation.getId())
            .map(existing -> {
                existing.updateFromDomain(reconciliation);
                return existing;
            })
            .orElseGet(() -> WalletReconciliationEntity.fromDomain(reconciliation));

        WalletReconciliationEntity saved = repository.save(entity);
        log.debug("Saved reconciliation {} for {}/{}: status={}",
                saved.getId(), saved.getWalletAccountId(), saved.getAsset(), saved.getStatus());
        return saved.toDomain();
    }

    /**
     * Sets the alert latch in the database if it is still clear.
     * Exactly one of several concurrent callers for the same pair gets true.
     */
    @Transactional
    public boolean claimAlert(UUID reconciliationId, Instant sentAt) {
        boolean claimed = repository.claimAlert(reconciliationId, sentAt) == 1;
        log.debug("Alert claim for reconciliation {}: claimed={}", reconciliationId, claimed);
        return claimed;
    }

    /**
     * Clears a latch set by {@link #claimAlert} at {@code sentAt}, so the next run alerts again.
     */
    @Transactional
    public boolean releaseAlert(UUID reconciliationId, Instant sentAt) {
        return repository.releaseAlert(reconciliationId, sentAt, Instant.now()) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<WalletReconciliation> findByPair(UUID walletAccountId, String asset) {
        return repository.findByWalletAccountIdAndAsset(walletAccountId, asset)
            .map(WalletReconciliationEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<WalletReconciliation> findByWallet(UUID walletAccountId) {
        return repository.findByWalletAccountIdOrderByAssetAsc(walletAccountId).stream()
            .map(WalletReconciliationEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<WalletReconciliation> findUnreconciled() {
        return repository.findOutOfThreshold(UNRESOLVED).stream()
            .map(WalletReconciliationEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnreconciled() {
        return repository.countOutOfThreshold(UNRESOLVED);
    }
}
