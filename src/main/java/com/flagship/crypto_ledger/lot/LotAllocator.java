package com.flagship.crypto_ledger.lot;

import com.flagship.crypto_ledger.ledger.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a disposal across lots already arranged in consumption order.
 *
 * Cost comes from each lot ({@link Lot#costOf}). Proceeds and fee are spread in
 * proportion to quantity; the last lot touched takes the remainder so the
 * allocations add up exactly to the inputs.
 */
final class LotAllocator {

    private LotAllocator() {
    }

    /**
     * @throws InsufficientLotsException if the lots hold less than {@code quantity}; nothing is allocated
     */
    static List<LotAllocation> allocate(String asset, List<Lot> orderedLots, BigDecimal quantity,
                                        BigDecimal proceeds, BigDecimal fee) {
        BigDecimal available = orderedLots.stream()
            .filter(Lot::isOpen)
            .map(Lot::getRemainingQuantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (available.compareTo(quantity) < 0) {
            throw new InsufficientLotsException(asset, quantity, available);
        }

        List<Lot> touched = new ArrayList<>();
        List<BigDecimal> takes = new ArrayList<>();
        BigDecimal left = quantity;
        for (Lot lot : orderedLots) {
            if (left.signum() <= 0) {
                break;
            }
            if (!lot.isOpen()) {
                continue;
            }
            BigDecimal take = lot.getRemainingQuantity().min(left);
            touched.add(lot);
            takes.add(take);
            left = left.subtract(take);
        }

        List<LotAllocation> allocations = new ArrayList<>(touched.size());
        BigDecimal proceedsAllocated = BigDecimal.ZERO;
        BigDecimal feeAllocated = BigDecimal.ZERO;
        for (int i = 0; i < touched.size(); i++) {
            Lot lot = touched.get(i);
            BigDecimal take = takes.get(i);
            boolean last = i == touched.size() - 1;

            BigDecimal proceedsShare = last
                ? proceeds.subtract(proceedsAllocated)
                : Amounts.prorate(proceeds, take, quantity);
            BigDecimal feeShare = last
                ? fee.subtract(feeAllocated)
                : Amounts.prorate(fee, take, quantity);
            proceedsAllocated = proceedsAllocated.add(proceedsShare);
            feeAllocated = feeAllocated.add(feeShare);

            allocations.add(new LotAllocation(lot, take, lot.costOf(take), proceedsShare, feeShare));
        }
        return allocations;
    }
}
