package com.flagship.crypto_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Balance of one asset at an address, as observed at a block.
 */
@Value
public class OnChainBalance {
    String asset;
    BigDecimal balance;
    Long blockNumber;
    Instant timestamp;
}
