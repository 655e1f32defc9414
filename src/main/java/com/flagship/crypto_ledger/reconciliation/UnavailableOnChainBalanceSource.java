package com.flagship.crypto_ledger.reconciliation;

import java.util.List;

/**
 * Stand-in used until a real balance source is wired. Every call fails, so
 * reconciliation runs abort cleanly instead of comparing against made-up balances.
 */
public class UnavailableOnChainBalanceSource implements OnChainBalanceSource {

    @Override
    public List<OnChainBalance> getBalances(String address, List<String> assets) {
        throw new IllegalStateException("No on-chain balance source is configured");
    }
}
