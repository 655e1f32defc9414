package com.flagship.crypto_ledger.ledger;

import lombok.Value;

/**
 * A value on an analytical dimension (e.g. cost center "CC-01" on dimension "COST_CENTER").
 */
@Value
public class DimensionValue {
    String dimensionCode;
    String code;
    String name;
}
