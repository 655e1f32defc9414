package com.flagship.crypto_ledger.lot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for lots and disposals. Disposals are insert-only; a lot's remaining
 * quantity can only go down.
 */
public interface LotRepository {

    /**
     * Takes the per-asset lock for the current transaction.
     */
    void lockAsset(String asset);

    /**
     * Open lots of the asset in FIFO order (acquisition date, then insertion order),
     * row-locked until the transaction ends.
     */
    List<Lot> findOpenLotsForUpdate(String asset);

    List<Lot> findOpenLots(String asset);

    Optional<Lot> findById(UUID lotId);

    /**
     * @return the assigned sequence number
     */
    long insert(Lot lot);

    void updateRemaining(Lot lot);

    void insertDisposals(List<LotDisposal> disposals);

    List<LotDisposal> findDisposalsByLot(UUID lotId);

    /**
     * Disposals dated within [from, to], optionally for one asset, oldest first.
     */
    List<LotDisposal> findDisposalsBetween(String asset, LocalDate from, LocalDate to);

    List<String> findAssetsWithOpenLots();
}
