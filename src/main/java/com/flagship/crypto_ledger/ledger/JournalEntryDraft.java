package com.flagship.crypto_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unvalidated request to record a journal entry.
 *
 * Invariant checked by {@link PostingValidator}: sum of debits equals sum of credits.
 */
@Value
@Builder
public class JournalEntryDraft {
    LocalDate date;
    String description;
    String reference;
    @Singular
    List<PostingDraft> postings;
    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * One side of an entry. Null debit or credit is read as zero.
     */
    @Value
    @With
    public static class PostingDraft {
        String accountCode;
        BigDecimal debit;
        BigDecimal credit;
        String description;
        String assetTag;
        Map<String, String> dimensions;

        public static PostingDraft debit(String accountCode, BigDecimal amount) {
            return new PostingDraft(accountCode, amount, BigDecimal.ZERO, null, null, Map.of());
        }

        public static PostingDraft credit(String accountCode, BigDecimal amount) {
            return new PostingDraft(accountCode, BigDecimal.ZERO, amount, null, null, Map.of());
        }

        public PostingDraft withDimension(String dimensionCode, String valueCode) {
            Map<String, String> tags = new LinkedHashMap<>(dimensions != null ? dimensions : Map.of());
            tags.put(dimensionCode, valueCode);
            return withDimensions(tags);
        }
    }
}
