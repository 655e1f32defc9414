package com.flagship.crypto_ledger.lot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Lot storage in maps. Refuses to let a lot's remaining quantity grow.
 */
public class InMemoryLotRepository implements LotRepository {

    private static final Comparator<Lot> FIFO = Comparator
        .comparing(Lot::getAcquisitionDate)
        .thenComparing(Lot::getSequenceNumber);

    private final Map<UUID, Lot> lots = new LinkedHashMap<>();
    private final List<LotDisposal> disposals = new ArrayList<>();
    private long nextSequence = 1;

    @Override
    public void lockAsset(String asset) {
    }

    @Override
    public synchronized List<Lot> findOpenLotsForUpdate(String asset) {
        return findOpenLots(asset);
    }

    @Override
    public synchronized List<Lot> findOpenLots(String asset) {
        return lots.values().stream()
            .filter(lot -> lot.getAsset().equals(asset) && lot.isOpen())
            .sorted(FIFO)
            .toList();
    }

    @Override
    public synchronized Optional<Lot> findById(UUID lotId) {
        return Optional.ofNullable(lots.get(lotId));
    }

    @Override
    public synchronized long insert(Lot lot) {
        long sequence = nextSequence++;
        lots.put(lot.getId(), lot.toBuilder().sequenceNumber(sequence).build());
        return sequence;
    }

    @Override
    public synchronized void updateRemaining(Lot lot) {
        Lot current = lots.get(lot.getId());
        if (current == null) {
            throw new IllegalStateException("No lot " + lot.getId());
        }
        if (lot.getRemainingQuantity().compareTo(current.getRemainingQuantity()) > 0) {
            throw new IllegalStateException("Lot " + lot.getId() + " cannot grow");
        }
        lots.put(lot.getId(), current.toBuilder()
            .remainingQuantity(lot.getRemainingQuantity())
            .remainingCostBasis(lot.getRemainingCostBasis())
            .fullyDisposed(lot.isFullyDisposed())
            .build());
    }

    @Override
    public synchronized void insertDisposals(List<LotDisposal> newDisposals) {
        disposals.addAll(newDisposals);
    }

    @Override
    public synchronized List<LotDisposal> findDisposalsByLot(UUID lotId) {
        return disposals.stream().filter(d -> d.getLotId().equals(lotId)).toList();
    }

    @Override
    public synchronized List<LotDisposal> findDisposalsBetween(String asset, LocalDate from, LocalDate to) {
        return disposals.stream()
            .filter(d -> asset == null || Objects.equals(d.getAsset(), asset))
            .filter(d -> !d.getDisposalDate().isBefore(from) && !d.getDisposalDate().isAfter(to))
            .toList();
    }

    @Override
    public synchronized List<String> findAssetsWithOpenLots() {
        return lots.values().stream()
            .filter(Lot::isOpen)
            .map(Lot::getAsset)
            .distinct()
            .sorted()
            .toList();
    }

    public synchronized List<LotDisposal> allDisposals() {
        return List.copyOf(disposals);
    }
}
