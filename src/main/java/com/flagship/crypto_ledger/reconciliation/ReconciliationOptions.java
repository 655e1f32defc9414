package com.flagship.crypto_ledger.reconciliation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Parameters of a reconciliation run.
 * An empty asset list means every asset the wallet tracks.
 */
@Value
@Builder
public class ReconciliationOptions {
    @Singular
    List<String> assets;
    @Builder.Default
    BigDecimal threshold = new BigDecimal("0.01");
    @Builder.Default
    BigDecimal alertThreshold = BigDecimal.ONE;

    public static ReconciliationOptions defaults() {
        return ReconciliationOptions.builder().build();
    }
}
