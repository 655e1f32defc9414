package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * A single debit or credit line of a {@link JournalEntry}.
 * Exactly one of debit/credit is non-zero (beyond {@link Amounts#EPSILON}).
 */
@Value
public class Posting {
    int lineNumber;
    String accountCode;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String assetTag;
    Map<String, String> dimensions;

    public Optional<String> assetTag() {
        return Optional.ofNullable(assetTag);
    }

    /**
     * Signed effect on the account: debit minus credit.
     */
    public BigDecimal getNetAmount() {
        return debit.subtract(credit);
    }
}
