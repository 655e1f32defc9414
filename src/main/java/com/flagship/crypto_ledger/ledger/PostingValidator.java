package com.flagship.crypto_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Admission check for journal entries.
 *
 * Enforces, before anything is written:
 * 1. At least one posting, an accounting date and a description
 * 2. Every posting names a known account and known dimension values
 * 3. Debit and credit are nonnegative, at most one of them is non-zero,
 *    and neither has more fractional digits than the ledger stores
 * 4. Debits equal credits (within {@link Amounts#EPSILON})
 *
 * The database repeats check 4 with a deferred trigger at commit time.
 */
@Component
@RequiredArgsConstructor
public class PostingValidator {

    private final AccountDirectory accountDirectory;

    /**
     * @return the normalized entry; the only input {@link HashChainLedger#append} accepts
     * @throws LedgerValidationException (or a subclass) naming the offending posting index
     */
    public ValidatedEntry validate(JournalEntryDraft draft) {
        if (draft == null) {
            throw new LedgerValidationException("Journal entry draft is required");
        }
        if (draft.getDate() == null) {
            throw new LedgerValidationException("Entry date is required");
        }
        if (draft.getDescription() == null || draft.getDescription().isBlank()) {
            throw new LedgerValidationException("Entry description is required");
        }
        if (draft.getPostings() == null || draft.getPostings().isEmpty()) {
            throw new LedgerValidationException("Entry must have at least one posting");
        }

        List<Posting> postings = new ArrayList<>(draft.getPostings().size());
        BigDecimal debitTotal = BigDecimal.ZERO;
        BigDecimal creditTotal = BigDecimal.ZERO;

        for (int i = 0; i < draft.getPostings().size(); i++) {
            Posting posting = validatePosting(draft.getPostings().get(i), i);
            debitTotal = debitTotal.add(posting.getDebit());
            creditTotal = creditTotal.add(posting.getCredit());
            postings.add(posting);
        }

        if (!Amounts.nearlyEqual(debitTotal, creditTotal)) {
            throw new ImbalancedEntryException(debitTotal, creditTotal);
        }

        Map<String, String> metadata = draft.getMetadata() != null
            ? Collections.unmodifiableMap(new TreeMap<>(draft.getMetadata()))
            : Map.of();

        return new ValidatedEntry(
            draft.getDate(),
            draft.getDescription().trim(),
            blankToNull(draft.getReference()),
            List.copyOf(postings),
            metadata
        );
    }

    private Posting validatePosting(JournalEntryDraft.PostingDraft draft, int index) {
        if (draft == null) {
            throw new LedgerValidationException("Posting is missing", index);
        }
        if (draft.getAccountCode() == null || draft.getAccountCode().isBlank()) {
            throw new LedgerValidationException("Account code is required", index);
        }

        BigDecimal debit = Amounts.orZero(draft.getDebit());
        BigDecimal credit = Amounts.orZero(draft.getCredit());

        if (debit.signum() < 0 || credit.signum() < 0) {
            throw new LedgerValidationException(String.format(
                "Negative amounts are not allowed: debit=%s, credit=%s",
                debit.toPlainString(), credit.toPlainString()), index);
        }
        if (debit.compareTo(Amounts.EPSILON) > 0 && credit.compareTo(Amounts.EPSILON) > 0) {
            throw new ImbalancedEntryException(String.format(
                "Posting has both debit and credit: debit=%s, credit=%s",
                debit.toPlainString(), credit.toPlainString()), index);
        }
        if (!Amounts.fitsStorageScale(debit) || !Amounts.fitsStorageScale(credit)) {
            throw new LedgerValidationException(String.format(
                "Amount has more than %d fractional digits", Amounts.SCALE), index);
        }

        String accountCode = draft.getAccountCode().trim();
        accountDirectory.resolveAccount(accountCode)
            .orElseThrow(() -> new UnknownAccountException(accountCode, index));

        Map<String, String> dimensions = new TreeMap<>();
        if (draft.getDimensions() != null) {
            for (Map.Entry<String, String> tag : draft.getDimensions().entrySet()) {
                accountDirectory.resolveDimensionValue(tag.getKey(), tag.getValue())
                    .orElseThrow(() -> new UnknownDimensionException(tag.getKey(), tag.getValue(), index));
                dimensions.put(tag.getKey(), tag.getValue());
            }
        }

        String assetTag = blankToNull(draft.getAssetTag());

        return new Posting(
            index + 1,
            accountCode,
            debit,
            credit,
            blankToNull(draft.getDescription()),
            assetTag != null ? assetTag.toUpperCase(Locale.ROOT) : null,
            Collections.unmodifiableMap(dimensions)
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
