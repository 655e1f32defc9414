package com.flagship.crypto_ledger.reconciliation;

/**
 * Outcome of the latest run for a wallet-asset pair.
 * Every run starts at PENDING and ends in one of the other three.
 */
public enum ReconciliationStatus {
    PENDING,
    /** Within threshold, or accepted by an operator. */
    RECONCILED,
    /** Out of threshold; no alert has gone out for this condition yet. */
    FLAGGED,
    /** Out of threshold and alerted. */
    ALERTED
}
