package com.flagship.crypto_ledger.reconciliation;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A monitored on-chain address and the GL account that books its holdings.
 */
@Value
public class WalletAccount {
    UUID id;
    String address;
    String chain;
    String network;
    String label;
    String glAccountCode;
    List<String> trackedAssets;
    boolean active;
}
