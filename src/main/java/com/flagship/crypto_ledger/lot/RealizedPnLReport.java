package com.flagship.crypto_ledger.lot;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Disposals in a period with totals. Short-term and long-term gains count only
 * disposals with a positive realized P&L.
 */
@Value
public class RealizedPnLReport {
    String asset;
    LocalDate from;
    LocalDate to;
    List<LotDisposal> disposals;
    int totalDisposals;
    BigDecimal totalProceeds;
    BigDecimal totalFees;
    BigDecimal totalCostBasis;
    BigDecimal totalRealizedPnL;
    BigDecimal shortTermGains;
    BigDecimal longTermGains;
}
