package com.flagship.crypto_ledger.lot;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The part of a disposal that consumed one lot. Immutable once written.
 *
 * realizedPnL = proceeds - fee - costBasis
 */
@Value
@Builder
public class LotDisposal {
    UUID id;
    UUID lotId;
    String asset;
    LocalDate acquisitionDate;
    LocalDate disposalDate;
    BigDecimal quantityDisposed;
    BigDecimal proceeds;
    BigDecimal fee;
    BigDecimal costBasis;
    BigDecimal realizedPnL;
    String disposalTxHash;
    UUID journalEntryId;
    Instant createdAt;

    /**
     * Held for more than one year.
     */
    public boolean isLongTerm() {
        return disposalDate.isAfter(acquisitionDate.plusYears(1));
    }
}
