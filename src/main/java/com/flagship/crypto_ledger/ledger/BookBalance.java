package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Point-in-time balance of one account for one asset: sum of debits minus sum of credits.
 */
@Value
public class BookBalance {
    String accountCode;
    String asset;
    LocalDate asOfDate;
    BigDecimal balance;
    int postingCount;
}
