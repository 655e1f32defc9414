package com.flagship.crypto_ledger.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReconciliationAlert {
    UUID walletAccountId;
    String walletAddress;
    String asset;
    BigDecimal onChainBalance;
    BigDecimal bookBalance;
    BigDecimal variance;
    BigDecimal variancePercent;
    AlertSeverity severity;
    String message;
    Instant detectedAt;
}
