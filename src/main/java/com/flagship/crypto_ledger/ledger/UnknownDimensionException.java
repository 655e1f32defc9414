package com.flagship.crypto_ledger.ledger;

public class UnknownDimensionException extends LedgerValidationException {

    private final String dimensionCode;
    private final String valueCode;

    public UnknownDimensionException(String dimensionCode, String valueCode, int postingIndex) {
        super(String.format("Dimension value not found: %s=%s", dimensionCode, valueCode), postingIndex);
        this.dimensionCode = dimensionCode;
        this.valueCode = valueCode;
    }

    public String getDimensionCode() {
        return dimensionCode;
    }

    public String getValueCode() {
        return valueCode;
    }
}
