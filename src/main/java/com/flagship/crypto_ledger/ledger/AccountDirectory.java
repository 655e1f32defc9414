package com.flagship.crypto_ledger.ledger;

import java.util.Optional;

/**
 * Lookup of accounts and dimension values owned outside the ledger core.
 */
public interface AccountDirectory {

    Optional<Account> resolveAccount(String code);

    Optional<DimensionValue> resolveDimensionValue(String dimensionCode, String valueCode);
}
