package com.flagship.crypto_ledger.lot;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Open position in one asset, summed over its open lots.
 */
@Value
public class LotBalance {
    String asset;
    BigDecimal totalQuantity;
    BigDecimal totalCostBasis;
    BigDecimal averageCostBasis;
    int lotCount;
}
