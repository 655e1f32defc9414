package com.flagship.crypto_ledger.reconciliation;

import java.util.List;

/**
 * Delivers reconciliation alerts. Called once per wallet run with all of that run's alerts.
 */
public interface AlertDispatcher {

    /**
     * No-op for an empty list.
     *
     * @throws AlertDispatchException if the batch could not be delivered
     */
    void sendBatchAlert(List<ReconciliationAlert> alerts);
}
