package com.flagship.crypto_ledger.reconciliation;

import java.util.List;

/**
 * Externally observed balances. Implementations talk to chain nodes or indexers.
 * A failure aborts the reconciliation run of the affected wallet only.
 */
public interface OnChainBalanceSource {

    List<OnChainBalance> getBalances(String address, List<String> assets);
}
