package com.flagship.crypto_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ReconciliationRunSummary {
    int walletsProcessed;
    int pairsReconciled;
    int withinThreshold;
    int outOfThreshold;
    int alertsDispatched;
    List<UUID> failedWallets;
    Instant startedAt;
    Instant completedAt;
}
