package com.flagship.crypto_ledger.lot;

import java.math.BigDecimal;

/**
 * A disposal asked for more than the open lots hold. The disposal is rejected
 * as a whole; no lot is touched.
 */
public class InsufficientLotsException extends IllegalStateException {

    private final String asset;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientLotsException(String asset, BigDecimal requested, BigDecimal available) {
        super(String.format("Insufficient lots for %s. Required: %s, Available: %s",
                asset, requested.toPlainString(), available.toPlainString()));
        this.asset = asset;
        this.requested = requested;
        this.available = available;
    }

    public String getAsset() {
        return asset;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
