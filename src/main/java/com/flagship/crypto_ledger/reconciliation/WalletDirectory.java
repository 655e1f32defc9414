package com.flagship.crypto_ledger.reconciliation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WalletDirectory {

    Optional<WalletAccount> findById(UUID walletAccountId);

    List<WalletAccount> findActive();

    /**
     * Takes the wallet's reconciliation lock, held until the current transaction ends.
     * Runs of the same wallet from any instance wait on it.
     */
    void lockForRun(UUID walletAccountId);

    /**
     * @throws com.flagship.crypto_ledger.ledger.UnknownAccountException if the GL account does not exist
     */
    WalletAccount register(String address, String chain, String network, String label,
                           String glAccountCode, List<String> trackedAssets);
}
