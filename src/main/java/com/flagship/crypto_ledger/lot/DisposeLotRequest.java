package com.flagship.crypto_ledger.lot;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Request to dispose of a quantity of an asset.
 * lotIds is only read for {@link DisposalMethod#SPECIFIC}, and is consumed in the order given.
 */
@Value
@Builder
public class DisposeLotRequest {
    String asset;
    BigDecimal quantity;
    BigDecimal proceeds;
    BigDecimal fee;
    LocalDate disposalDate;
    String disposalTxHash;
    @Builder.Default
    DisposalMethod method = DisposalMethod.FIFO;
    @Singular
    List<UUID> lotIds;
}
