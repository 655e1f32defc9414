package com.flagship.crypto_ledger.lot;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What one lot contributes to a disposal.
 */
@Value
public class LotAllocation {
    Lot lot;
    BigDecimal quantity;
    BigDecimal costBasis;
    BigDecimal proceeds;
    BigDecimal fee;

    public BigDecimal getRealizedPnL() {
        return proceeds.subtract(fee).subtract(costBasis);
    }

    /**
     * The lot as it stands after this allocation is applied.
     */
    public Lot getConsumedLot() {
        return lot.consume(quantity, costBasis);
    }
}
