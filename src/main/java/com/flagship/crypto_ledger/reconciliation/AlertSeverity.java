package com.flagship.crypto_ledger.reconciliation;

public enum AlertSeverity {
    WARNING,
    CRITICAL
}
