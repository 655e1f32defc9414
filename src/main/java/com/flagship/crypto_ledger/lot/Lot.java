package com.flagship.crypto_ledger.lot;

import com.flagship.crypto_ledger.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An acquisition lot: a quantity of one asset bought (or mined, staked, received)
 * at a known total cost.
 *
 * Key principles:
 * - remainingQuantity only ever decreases, and never below zero
 * - remainingCostBasis is what is left of costBasis; closing a lot takes exactly that remainder
 * - State changes are immutable (consume returns a new Lot)
 */
@Value
@Builder(toBuilder = true)
public class Lot {
    UUID id;
    Long sequenceNumber;
    String asset;
    BigDecimal originalQuantity;
    BigDecimal remainingQuantity;
    BigDecimal costBasis;
    BigDecimal remainingCostBasis;
    LocalDate acquisitionDate;
    LotSourceType sourceType;
    String acquisitionTxHash;
    UUID journalEntryId;
    boolean fullyDisposed;
    Instant createdAt;

    /**
     * Creates a new, untouched lot.
     */
    public static Lot acquire(String asset, BigDecimal quantity, BigDecimal costBasis, LocalDate acquisitionDate,
                              LotSourceType sourceType, String acquisitionTxHash, UUID journalEntryId) {
        return new Lot(
            UUID.randomUUID(),
            null,
            asset,
            quantity,
            quantity,
            costBasis,
            costBasis,
            acquisitionDate,
            sourceType != null ? sourceType : LotSourceType.PURCHASE,
            acquisitionTxHash,
            journalEntryId,
            false,
            Instant.now()
        );
    }

    public boolean isOpen() {
        return !fullyDisposed && remainingQuantity.signum() > 0;
    }

    /**
     * Cost basis carried by {@code quantity} units of this lot.
     * Taking the whole remainder returns exactly the remaining cost basis.
     */
    public BigDecimal costOf(BigDecimal quantity) {
        if (quantity.compareTo(remainingQuantity) >= 0) {
            return remainingCostBasis;
        }
        BigDecimal proportional = Amounts.prorate(costBasis, quantity, originalQuantity);
        return proportional.min(remainingCostBasis);
    }

    /**
     * @return a new Lot with the quantity and its cost removed
     * @throws IllegalStateException if the quantity is not positive or exceeds what remains
     */
    public Lot consume(BigDecimal quantity, BigDecimal cost) {
        if (quantity.signum() <= 0) {
            throw new IllegalStateException("Consumed quantity must be positive: " + quantity.toPlainString());
        }
        if (quantity.compareTo(remainingQuantity) > 0) {
            throw new IllegalStateException(String.format(
                "Cannot consume %s from lot %s holding %s",
                quantity.toPlainString(), id, remainingQuantity.toPlainString()));
        }
        BigDecimal newRemaining = remainingQuantity.subtract(quantity);
        BigDecimal newRemainingCost = newRemaining.signum() == 0
            ? BigDecimal.ZERO
            : remainingCostBasis.subtract(cost);
        return toBuilder()
            .remainingQuantity(newRemaining)
            .remainingCostBasis(newRemainingCost)
            .fullyDisposed(newRemaining.signum() == 0)
            .build();
    }
}
