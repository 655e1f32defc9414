package com.flagship.crypto_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * An entry that passed {@link PostingValidator}. Only the validator creates these,
 * which keeps unbalanced payloads away from {@link HashChainLedger#append}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class ValidatedEntry {
    LocalDate date;
    String description;
    String reference;
    List<Posting> postings;
    Map<String, String> metadata;
}
