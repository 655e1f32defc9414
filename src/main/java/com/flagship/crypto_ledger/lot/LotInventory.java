package com.flagship.crypto_ledger.lot;

import com.flagship.crypto_ledger.ledger.Amounts;
import com.flagship.crypto_ledger.ledger.JournalEntry;
import com.flagship.crypto_ledger.ledger.JournalEntryDraft;
import com.flagship.crypto_ledger.ledger.JournalEntryDraft.PostingDraft;
import com.flagship.crypto_ledger.ledger.JournalService;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-asset lot inventory: cost basis and realized gain/loss on disposals.
 *
 * Key principles:
 * - Creates and disposals of one asset are serialized (in-process lock, advisory lock, row locks)
 * - A disposal is all-or-nothing: every touched lot and every disposal record, or nothing
 * - Allocations add up exactly: cost closes out each lot, proceeds and fee sum to the inputs
 * - Realized gain/loss is journalized in the same transaction when enabled
 *
 * Lock order is asset, then ledger. The ledger never takes an asset lock.
 */
@Service
@Slf4j
public class LotInventory {

    private static final String PNL_ENTRY_TYPE = "crypto_pnl";

    private final LotRepository repository;
    private final JournalService journalService;
    private final AssetLockRegistry assetLocks;
    private final TransactionOperations writeTransactions;
    private final LedgerMetrics metrics;

    @Value("${lots.journal.enabled:true}")
    private boolean journalEnabled = true;

    @Value("${lots.journal.min-amount:0.01}")
    private BigDecimal journalMinAmount = new BigDecimal("0.01");

    @Value("${lots.journal.proceeds-account:1100}")
    private String proceedsAccount = "1100";

    @Value("${lots.journal.gain-account:4100}")
    private String gainAccount = "4100";

    @Value("${lots.journal.loss-account:6200}")
    private String lossAccount = "6200";

    public LotInventory(LotRepository repository,
                        JournalService journalService,
                        AssetLockRegistry assetLocks,
                        @Qualifier("ledgerWriteTransactions") TransactionOperations writeTransactions,
                        LedgerMetrics metrics) {
        this.repository = repository;
        this.journalService = journalService;
        this.assetLocks = assetLocks;
        this.writeTransactions = writeTransactions;
        this.metrics = metrics;
    }

    /**
     * Records a new acquisition lot.
     *
     * @throws InvalidQuantityException if quantity is not positive or cost basis is negative
     */
    public Lot createLot(CreateLotRequest request) {
        String asset = normalizeAsset(request.getAsset());
        requirePositive(request.getQuantity(), "Lot quantity");
        requireNonNegative(request.getCostBasis(), "Cost basis");
        if (request.getAcquisitionDate() == null) {
            throw new IllegalArgumentException("Acquisition date is required");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ASSET_MDC_KEY, asset);
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            Lot lot = Lot.acquire(
                asset,
                request.getQuantity(),
                request.getCostBasis(),
                request.getAcquisitionDate(),
                request.getSourceType(),
                request.getAcquisitionTxHash(),
                request.getJournalEntryId()
            );

            Lot stored = underAssetLock(asset, () -> {
                long sequenceNumber = repository.insert(lot);
                return lot.toBuilder().sequenceNumber(sequenceNumber).build();
            });

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLotCreated(asset, "success");
            metrics.recordLatency("create_lot", duration);
            log.info("Lot created: lotId={}, quantity={}, costBasis={}, acquired={}, source={}",
                    stored.getId(), stored.getOriginalQuantity().toPlainString(),
                    stored.getCostBasis().toPlainString(), stored.getAcquisitionDate(), stored.getSourceType());
            return stored;

        } catch (RuntimeException e) {
            metrics.recordLotCreated(asset, "error");
            log.error("Lot creation failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ASSET_MDC_KEY);
        }
    }

    /**
     * Disposes of a quantity of an asset, consuming open lots in the requested order.
     *
     * @throws InvalidQuantityException if quantity is not positive or proceeds/fee are negative
     * @throws InsufficientLotsException if the open lots hold less than the quantity; nothing changes
     */
    public LotDisposalResult disposeLot(DisposeLotRequest request) {
        String asset = normalizeAsset(request.getAsset());
        requirePositive(request.getQuantity(), "Disposal quantity");
        requireNonNegative(request.getProceeds(), "Proceeds");
        BigDecimal fee = Amounts.orZero(request.getFee());
        requireNonNegative(fee, "Fee");
        if (request.getDisposalDate() == null) {
            throw new IllegalArgumentException("Disposal date is required");
        }
        DisposalMethod method = request.getMethod() != null ? request.getMethod() : DisposalMethod.FIFO;
        if (method == DisposalMethod.SPECIFIC && (request.getLotIds() == null || request.getLotIds().isEmpty())) {
            throw new IllegalArgumentException("SPECIFIC disposal requires lot ids");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ASSET_MDC_KEY, asset);
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            LotDisposalResult result = underAssetLock(asset, () -> applyDisposal(asset, request, fee, method));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLotDisposal(asset, "success");
            metrics.recordLatency("dispose_lot", duration);
            log.info("Lots disposed: method={}, quantity={}, lotsTouched={}, proceeds={}, costBasis={}, realizedPnL={}, journalEntryId={}, duration={}ms",
                    method, result.getTotalQuantity().toPlainString(), result.getDisposals().size(),
                    result.getTotalProceeds().toPlainString(), result.getTotalCostBasis().toPlainString(),
                    result.getTotalRealizedPnL().toPlainString(), result.getJournalEntryId(), duration);
            return result;

        } catch (InsufficientLotsException e) {
            metrics.recordLotDisposal(asset, "insufficient");
            log.warn("Lot disposal rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordLotDisposal(asset, "error");
            log.error("Lot disposal failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ASSET_MDC_KEY);
        }
    }

    private LotDisposalResult applyDisposal(String asset, DisposeLotRequest request, BigDecimal fee,
                                            DisposalMethod method) {
        List<Lot> openLots = repository.findOpenLotsForUpdate(asset);
        List<Lot> ordered = arrange(asset, openLots, method, request.getLotIds());

        List<LotAllocation> allocations = LotAllocator.allocate(
            asset, ordered, request.getQuantity(), request.getProceeds(), fee);

        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal totalPnL = BigDecimal.ZERO;
        for (LotAllocation allocation : allocations) {
            totalCost = totalCost.add(allocation.getCostBasis());
            totalPnL = totalPnL.add(allocation.getRealizedPnL());
        }

        UUID journalEntryId = null;
        if (journalEnabled && totalPnL.abs().compareTo(journalMinAmount) >= 0) {
            journalEntryId = journalizePnL(asset, totalPnL, request).getId();
        }

        Instant now = Instant.now();
        List<LotDisposal> disposals = new ArrayList<>(allocations.size());
        for (LotAllocation allocation : allocations) {
            repository.updateRemaining(allocation.getConsumedLot());
            disposals.add(LotDisposal.builder()
                .id(UUID.randomUUID())
                .lotId(allocation.getLot().getId())
                .asset(asset)
                .acquisitionDate(allocation.getLot().getAcquisitionDate())
                .disposalDate(request.getDisposalDate())
                .quantityDisposed(allocation.getQuantity())
                .proceeds(allocation.getProceeds())
                .fee(allocation.getFee())
                .costBasis(allocation.getCostBasis())
                .realizedPnL(allocation.getRealizedPnL())
                .disposalTxHash(request.getDisposalTxHash())
                .journalEntryId(journalEntryId)
                .createdAt(now)
                .build());
        }
        repository.insertDisposals(disposals);

        return new LotDisposalResult(
            asset,
            List.copyOf(disposals),
            request.getQuantity(),
            request.getProceeds(),
            fee,
            totalCost,
            totalPnL,
            journalEntryId
        );
    }

    /**
     * Puts the open lots into consumption order for the method.
     */
    private List<Lot> arrange(String asset, List<Lot> openLots, DisposalMethod method, List<UUID> lotIds) {
        return switch (method) {
            case FIFO -> openLots;
            case LIFO -> {
                List<Lot> reversed = new ArrayList<>(openLots);
                Collections.reverse(reversed);
                yield reversed;
            }
            case SPECIFIC -> {
                Map<UUID, Lot> byId = new LinkedHashMap<>();
                openLots.forEach(lot -> byId.put(lot.getId(), lot));
                Set<UUID> seen = new HashSet<>();
                List<Lot> chosen = new ArrayList<>(lotIds.size());
                for (UUID lotId : lotIds) {
                    if (!seen.add(lotId)) {
                        throw new IllegalArgumentException("Lot listed more than once: " + lotId);
                    }
                    Lot lot = byId.get(lotId);
                    if (lot == null) {
                        throw new IllegalArgumentException(String.format("Lot %s is not an open %s lot", lotId, asset));
                    }
                    chosen.add(lot);
                }
                yield chosen;
            }
        };
    }

    private JournalEntry journalizePnL(String asset, BigDecimal realizedPnL, DisposeLotRequest request) {
        boolean gain = realizedPnL.signum() > 0;
        BigDecimal amount = realizedPnL.abs();

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("type", PNL_ENTRY_TYPE);
        metadata.put("asset", asset);
        metadata.put("realizedPnL", Amounts.canonical(realizedPnL));
        metadata.put("quantity", Amounts.canonical(request.getQuantity()));

        JournalEntryDraft draft = JournalEntryDraft.builder()
            .date(request.getDisposalDate())
            .description(String.format("Realized %s on %s disposal", gain ? "gain" : "loss", asset))
            .reference(request.getDisposalTxHash())
            .metadata(metadata)
            .posting(gain
                ? PostingDraft.debit(proceedsAccount, amount)
                : PostingDraft.debit(lossAccount, amount))
            .posting(gain
                ? PostingDraft.credit(gainAccount, amount)
                : PostingDraft.credit(proceedsAccount, amount))
            .build();

        JournalEntry entry = journalService.createEntry(draft);
        log.debug("Realized P&L journalized: entryId={}, amount={}", entry.getId(), amount.toPlainString());
        return entry;
    }

    public LotBalance getLotBalance(String asset) {
        String normalized = normalizeAsset(asset);
        List<Lot> lots = repository.findOpenLots(normalized);

        BigDecimal totalQuantity = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        for (Lot lot : lots) {
            totalQuantity = totalQuantity.add(lot.getRemainingQuantity());
            totalCost = totalCost.add(lot.getRemainingCostBasis());
        }
        BigDecimal average = totalQuantity.signum() > 0
            ? totalCost.divide(totalQuantity, Amounts.SCALE, Amounts.ROUNDING)
            : BigDecimal.ZERO;

        return new LotBalance(normalized, totalQuantity, totalCost, average, lots.size());
    }

    public List<LotBalance> getAllBalances() {
        return repository.findAssetsWithOpenLots().stream()
            .map(this::getLotBalance)
            .toList();
    }

    /**
     * Disposals dated within [from, to], optionally limited to one asset.
     */
    public RealizedPnLReport getRealizedPnL(String asset, LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException(String.format("Invalid period: %s to %s", from, to));
        }
        String normalized = asset != null && !asset.isBlank() ? normalizeAsset(asset) : null;
        List<LotDisposal> disposals = repository.findDisposalsBetween(normalized, from, to);

        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal pnl = BigDecimal.ZERO;
        BigDecimal shortTerm = BigDecimal.ZERO;
        BigDecimal longTerm = BigDecimal.ZERO;
        for (LotDisposal disposal : disposals) {
            proceeds = proceeds.add(disposal.getProceeds());
            fees = fees.add(disposal.getFee());
            cost = cost.add(disposal.getCostBasis());
            pnl = pnl.add(disposal.getRealizedPnL());
            if (disposal.getRealizedPnL().signum() > 0) {
                if (disposal.isLongTerm()) {
                    longTerm = longTerm.add(disposal.getRealizedPnL());
                } else {
                    shortTerm = shortTerm.add(disposal.getRealizedPnL());
                }
            }
        }

        return new RealizedPnLReport(normalized, from, to, List.copyOf(disposals), disposals.size(),
            proceeds, fees, cost, pnl, shortTerm, longTerm);
    }

    public List<Lot> findOpenLots(String asset) {
        return repository.findOpenLots(normalizeAsset(asset));
    }

    public List<LotDisposal> findDisposals(UUID lotId) {
        return repository.findDisposalsByLot(lotId);
    }

    /**
     * Runs the work in a transaction holding the asset's in-process and database locks.
     * Inside an enclosing transaction the in-process lock is held until that transaction completes.
     */
    private <T> T underAssetLock(String asset, Supplier<T> work) {
        ReentrantLock lock = assetLocks.acquire(asset);

        if (TransactionSynchronizationManager.isActualTransactionActive()
                && TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                repository.lockAsset(asset);
                T result = work.get();
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCompletion(int status) {
                        lock.unlock();
                    }
                });
                return result;
            } catch (RuntimeException e) {
                lock.unlock();
                throw e;
            }
        }

        try {
            return writeTransactions.execute(status -> {
                repository.lockAsset(asset);
                return work.get();
            });
        } finally {
            lock.unlock();
        }
    }

    private static String normalizeAsset(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Asset is required");
        }
        return asset.trim().toUpperCase(Locale.ROOT);
    }

    private static void requirePositive(BigDecimal value, String what) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidQuantityException(what + " must be positive: " + (value != null ? value.toPlainString() : null));
        }
        requireStorageScale(value, what);
    }

    private static void requireNonNegative(BigDecimal value, String what) {
        if (value == null || value.signum() < 0) {
            throw new InvalidQuantityException(what + " must not be negative: " + (value != null ? value.toPlainString() : null));
        }
        requireStorageScale(value, what);
    }

    private static void requireStorageScale(BigDecimal value, String what) {
        if (!Amounts.fitsStorageScale(value)) {
            throw new InvalidQuantityException(String.format(
                "%s has more than %d fractional digits: %s", what, Amounts.SCALE, value.toPlainString()));
        }
    }
}
