package com.flagship.crypto_ledger.reconciliation;

import com.flagship.crypto_ledger.ledger.BookBalance;
import com.flagship.crypto_ledger.ledger.BookBalanceCalculator;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.LedgerMetrics;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Compares on-chain wallet balances with the book balance of the wallet's GL account.
 *
 * Flow per wallet run:
 * 1. Fetch on-chain balances for the tracked (or requested) assets
 * 2. Derive the book balance as of the UTC date of each on-chain observation
 * 3. Record the measurement on the pair's state and persist it
 * 4. Claim the alert latch of each pair that needs an alert, then dispatch the
 *    claimed alerts as one batch
 *
 * Runs of one wallet are serialized: an in-process lock per wallet plus a database
 * lock held for the run's transaction, so overlapping scheduler runs on any number
 * of instances take turns. The latch is set with a conditional update before
 * dispatch, so a pair is alerted at most once per variance. If dispatch fails the
 * claims are released and the next run sends the alerts again.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    private final WalletDirectory walletDirectory;
    private final OnChainBalanceSource balanceSource;
    private final BookBalanceCalculator bookBalanceCalculator;
    private final WalletReconciliationPersistenceService persistenceService;
    private final AlertDispatcher alertDispatcher;
    private final LedgerMetrics metrics;
    private final TransactionOperations writeTransactions;
    private final Duration lockTimeout;

    private final ConcurrentMap<UUID, ReentrantLock> walletLocks = new ConcurrentHashMap<>();

    public ReconciliationEngine(WalletDirectory walletDirectory,
                                OnChainBalanceSource balanceSource,
                                BookBalanceCalculator bookBalanceCalculator,
                                WalletReconciliationPersistenceService persistenceService,
                                AlertDispatcher alertDispatcher,
                                LedgerMetrics metrics,
                                @Qualifier("ledgerWriteTransactions") TransactionOperations writeTransactions,
                                @Value("${reconciliation.lock-timeout:30s}") Duration lockTimeout) {
        this.walletDirectory = walletDirectory;
        this.balanceSource = balanceSource;
        this.bookBalanceCalculator = bookBalanceCalculator;
        this.persistenceService = persistenceService;
        this.alertDispatcher = alertDispatcher;
        this.metrics = metrics;
        this.writeTransactions = writeTransactions;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Reconciles every requested asset of one wallet.
     *
     * @return the pair states after the run, one per reconciled asset
     * @throws IllegalArgumentException if the wallet does not exist
     */
    public List<WalletReconciliation> reconcileWallet(UUID walletAccountId, ReconciliationOptions options) {
        return runWallet(walletAccountId, options).getReconciliations();
    }

    /**
     * Reconciles every active wallet. A failing wallet is logged and skipped;
     * the others still run.
     */
    public ReconciliationRunSummary reconcileAllWallets(ReconciliationOptions options) {
        Instant startedAt = Instant.now();
        List<WalletAccount> wallets = walletDirectory.findActive();
        log.info("Reconciliation run started: wallets={}", wallets.size());

        int pairs = 0;
        int within = 0;
        int outOf = 0;
        int alerts = 0;
        List<UUID> failedWallets = new ArrayList<>();

        for (WalletAccount wallet : wallets) {
            try {
                WalletRun run = runWallet(wallet.getId(), options);
                for (WalletReconciliation reconciliation : run.getReconciliations()) {
                    pairs++;
                    if (reconciliation.isWithinThreshold()) {
                        within++;
                    } else {
                        outOf++;
                    }
                }
                alerts += run.getAlertsDispatched();
            } catch (RuntimeException e) {
                failedWallets.add(wallet.getId());
                log.error("Reconciliation failed for wallet {} ({}): {}",
                        wallet.getId(), wallet.getAddress(), e.getMessage(), e);
            }
        }

        metrics.setUnresolvedReconciliations(persistenceService.countUnreconciled());

        ReconciliationRunSummary summary = new ReconciliationRunSummary(
            wallets.size(), pairs, within, outOf, alerts, List.copyOf(failedWallets), startedAt, Instant.now());
        log.info("Reconciliation run completed: wallets={}, pairs={}, within={}, outOfThreshold={}, alerts={}, failed={}",
                summary.getWalletsProcessed(), pairs, within, outOf, alerts, failedWallets.size());
        return summary;
    }

    /**
     * Pairs currently out of threshold with |variance| at least {@code minVariance},
     * largest absolute variance percent first.
     */
    public List<WalletReconciliation> getUnreconciledItems(BigDecimal minVariance) {
        BigDecimal floor = minVariance == null ? BigDecimal.ZERO : minVariance.abs();
        return persistenceService.findUnreconciled().stream()
            .filter(r -> r.getVariance() != null && r.getVariance().abs().compareTo(floor) >= 0)
            .sorted(Comparator.comparing((WalletReconciliation r) -> r.getVariancePercent().abs()).reversed())
            .toList();
    }

    /**
     * Operator sign-off of a pair. Clears the alert latch.
     *
     * @throws IllegalArgumentException if the pair was never reconciled
     */
    public WalletReconciliation resolve(UUID walletAccountId, String asset, String resolvedBy, String resolution) {
        String normalizedAsset = normalize(asset);
        WalletReconciliation resolved = underWalletLock(walletAccountId, () -> {
            WalletReconciliation current = persistenceService.findByPair(walletAccountId, normalizedAsset)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                    "No reconciliation for wallet %s and asset %s", walletAccountId, normalizedAsset)));
            return persistenceService.save(current.resolve(resolvedBy, resolution));
        });
        metrics.setUnresolvedReconciliations(persistenceService.countUnreconciled());
        log.info("Reconciliation resolved: wallet={}, asset={}, resolvedBy={}, variance={}",
                walletAccountId, normalizedAsset, resolvedBy,
                resolved.getVariance() == null ? null : resolved.getVariance().toPlainString());
        return resolved;
    }

    public List<WalletReconciliation> findByWallet(UUID walletAccountId) {
        return persistenceService.findByWallet(walletAccountId);
    }

    private WalletRun runWallet(UUID walletAccountId, ReconciliationOptions options) {
        WalletAccount wallet = walletDirectory.findById(walletAccountId)
            .orElseThrow(() -> new IllegalArgumentException("Wallet account not found: " + walletAccountId));
        return underWalletLock(walletAccountId, () -> runLocked(wallet, options));
    }

    private WalletRun runLocked(WalletAccount wallet, ReconciliationOptions options) {
        UUID walletAccountId = wallet.getId();
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            MDC.put(CorrelationContext.WALLET_ACCOUNT_ID_MDC_KEY, walletAccountId.toString());

            Set<String> assets = assetsToReconcile(wallet, options);
            if (assets.isEmpty()) {
                log.info("Wallet {} has no assets to reconcile", walletAccountId);
                return new WalletRun(List.of(), 0);
            }

            List<OnChainBalance> balances = balanceSource.getBalances(wallet.getAddress(), List.copyOf(assets));

            List<WalletReconciliation> reconciled = new ArrayList<>();
            List<WalletReconciliation> alerted = new ArrayList<>();
            List<ReconciliationAlert> alerts = new ArrayList<>();

            for (OnChainBalance onChain : balances) {
                String asset = normalize(onChain.getAsset());
                if (!assets.contains(asset)) {
                    log.debug("Skipping unrequested asset {} for wallet {}", asset, walletAccountId);
                    continue;
                }

                LocalDate asOfDate = LocalDate.ofInstant(onChain.getTimestamp(), ZoneOffset.UTC);
                BookBalance book = bookBalanceCalculator.balanceAsOf(wallet.getGlAccountCode(), asset, asOfDate);
                VarianceAssessment assessment = VarianceAssessment.assess(
                    onChain.getBalance(), book.getBalance(), options.getThreshold(), options.getAlertThreshold());

                WalletReconciliation saved = recordPair(wallet, asset, onChain, book, assessment, options.getThreshold());
                reconciled.add(saved);
                metrics.recordReconciliation(asset, saved.getStatus().name());

                if (saved.isAlertDue(assessment)) {
                    alerted.add(saved);
                    alerts.add(toAlert(wallet, saved));
                }
            }

            int dispatched = dispatch(alerts, alerted, reconciled);

            metrics.recordLatency("reconcile_wallet", System.currentTimeMillis() - startTime);
            log.info("Wallet reconciled: wallet={}, pairs={}, alerts={}", walletAccountId, reconciled.size(), dispatched);
            return new WalletRun(List.copyOf(reconciled), dispatched);
        } finally {
            MDC.remove(CorrelationContext.WALLET_ACCOUNT_ID_MDC_KEY);
        }
    }

    private WalletReconciliation recordPair(WalletAccount wallet, String asset, OnChainBalance onChain,
                                            BookBalance book, VarianceAssessment assessment, BigDecimal threshold) {
        WalletReconciliation current = persistenceService.findByPair(wallet.getId(), asset)
            .orElseGet(() -> WalletReconciliation.pending(wallet.getId(), wallet.getAddress(), asset));

        WalletReconciliation recorded = current.startRun().record(onChain, book, assessment, threshold);
        WalletReconciliation saved = persistenceService.save(recorded);

        if (assessment.isWithinThreshold()) {
            log.debug("Pair within threshold: asset={}, onChain={}, book={}",
                    asset, onChain.getBalance().toPlainString(), book.getBalance().toPlainString());
        } else {
            log.warn("Pair out of threshold: asset={}, onChain={}, book={}, variance={}, variancePercent={}%, status={}",
                    asset, onChain.getBalance().toPlainString(), book.getBalance().toPlainString(),
                    assessment.getVariance().toPlainString(), assessment.getVariancePercent().toPlainString(),
                    saved.getStatus());
        }
        return saved;
    }

    /**
     * Claims the latch of each pair, then sends the claimed alerts as one batch.
     * Returns the number of alerts delivered. A failed batch releases its claims
     * and is left for the next run.
     */
    private int dispatch(List<ReconciliationAlert> alerts, List<WalletReconciliation> alerted,
                         List<WalletReconciliation> reconciled) {
        if (alerts.isEmpty()) {
            return 0;
        }

        // Microsecond precision matches the stored timestamp, so a release finds its own claim
        Instant sentAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        List<ReconciliationAlert> claimedAlerts = new ArrayList<>();
        List<WalletReconciliation> claimedPairs = new ArrayList<>();
        for (int i = 0; i < alerted.size(); i++) {
            WalletReconciliation pair = alerted.get(i);
            if (persistenceService.claimAlert(pair.getId(), sentAt)) {
                claimedPairs.add(pair);
                claimedAlerts.add(alerts.get(i));
            } else {
                log.info("Alert already sent for {}/{}, skipping", pair.getWalletAccountId(), pair.getAsset());
            }
        }
        if (claimedAlerts.isEmpty()) {
            return 0;
        }

        try {
            alertDispatcher.sendBatchAlert(claimedAlerts);
        } catch (RuntimeException e) {
            for (WalletReconciliation pair : claimedPairs) {
                persistenceService.releaseAlert(pair.getId(), sentAt);
            }
            metrics.recordAlertsDispatched(claimedAlerts.size(), "failed");
            log.error("Alert dispatch failed, {} alerts will be retried on the next run: {}",
                    claimedAlerts.size(), e.getMessage(), e);
            return 0;
        }

        for (WalletReconciliation pair : claimedPairs) {
            WalletReconciliation latched = pair.markAlerted(sentAt);
            reconciled.replaceAll(r -> r.getId().equals(latched.getId()) ? latched : r);
        }
        metrics.recordAlertsDispatched(claimedAlerts.size(), "sent");
        return claimedAlerts.size();
    }

    /**
     * Runs the work in one transaction holding both the in-process and the database lock of the wallet.
     *
     * @throws CannotAcquireLockException if the in-process lock was not obtained in time
     */
    private <T> T underWalletLock(UUID walletAccountId, Supplier<T> work) {
        ReentrantLock lock = walletLocks.computeIfAbsent(walletAccountId, key -> new ReentrantLock(true));
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                metrics.recordLockTimeout("reconcile_wallet");
                throw new CannotAcquireLockException(String.format(
                    "Timed out after %dms waiting for the reconciliation lock of wallet %s",
                    lockTimeout.toMillis(), walletAccountId));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException(
                "Interrupted while waiting for the reconciliation lock of wallet " + walletAccountId, e);
        }
        try {
            return writeTransactions.execute(status -> {
                walletDirectory.lockForRun(walletAccountId);
                return work.get();
            });
        } finally {
            lock.unlock();
        }
    }

    private ReconciliationAlert toAlert(WalletAccount wallet, WalletReconciliation pair) {
        String message = String.format("%s balance mismatch on %s: on-chain %s, book %s, variance %s (%s%%)",
            pair.getAsset(), wallet.getAddress(),
            pair.getOnChainBalance().toPlainString(), pair.getBookBalance().toPlainString(),
            pair.getVariance().toPlainString(), pair.getVariancePercent().toPlainString());
        return ReconciliationAlert.builder()
            .walletAccountId(wallet.getId())
            .walletAddress(wallet.getAddress())
            .asset(pair.getAsset())
            .onChainBalance(pair.getOnChainBalance())
            .bookBalance(pair.getBookBalance())
            .variance(pair.getVariance())
            .variancePercent(pair.getVariancePercent())
            .severity(pair.getSeverity())
            .message(message)
            .detectedAt(pair.getUpdatedAt())
            .build();
    }

    private static Set<String> assetsToReconcile(WalletAccount wallet, ReconciliationOptions options) {
        List<String> requested = options.getAssets().isEmpty() ? wallet.getTrackedAssets() : options.getAssets();
        Set<String> assets = new LinkedHashSet<>();
        for (String asset : requested) {
            assets.add(normalize(asset));
        }
        return assets;
    }

    private static String normalize(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Asset is required");
        }
        return asset.trim().toUpperCase(Locale.ROOT);
    }

    @Getter
    @RequiredArgsConstructor
    private static class WalletRun {
        private final List<WalletReconciliation> reconciliations;
        private final int alertsDispatched;
    }
}
