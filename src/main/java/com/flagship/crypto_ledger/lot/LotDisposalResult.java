package com.flagship.crypto_ledger.lot;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Value
public class LotDisposalResult {
    String asset;
    List<LotDisposal> disposals;
    BigDecimal totalQuantity;
    BigDecimal totalProceeds;
    BigDecimal totalFee;
    BigDecimal totalCostBasis;
    BigDecimal totalRealizedPnL;
    UUID journalEntryId;

    public Optional<UUID> journalEntryId() {
        return Optional.ofNullable(journalEntryId);
    }
}
