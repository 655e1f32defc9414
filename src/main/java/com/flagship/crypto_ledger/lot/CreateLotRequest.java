package com.flagship.crypto_ledger.lot;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateLotRequest {
    String asset;
    BigDecimal quantity;
    BigDecimal costBasis;
    LocalDate acquisitionDate;
    @Builder.Default
    LotSourceType sourceType = LotSourceType.PURCHASE;
    String acquisitionTxHash;
    UUID journalEntryId;
}
