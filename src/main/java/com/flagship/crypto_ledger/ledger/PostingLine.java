package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Flattened posting row used for balance replay.
 */
@Value
public class PostingLine {
    UUID entryId;
    LocalDate entryDate;
    String accountCode;
    BigDecimal debit;
    BigDecimal credit;
    String assetTag;
}
