package com.flagship.crypto_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Replays postings to derive an account balance for one asset as of a date.
 * Balances are derived, never stored.
 *
 * All postings are read in a single statement, and an append writes an entry
 * and its postings in one transaction, so a partially applied append is never seen.
 */
@Service
@Slf4j
public class BookBalanceCalculator {

    private final JournalEntryRepository repository;
    private final boolean includeUntaggedPostings;

    public BookBalanceCalculator(JournalEntryRepository repository,
                                 @Value("${ledger.balance.include-untagged-postings:false}") boolean includeUntaggedPostings) {
        this.repository = repository;
        this.includeUntaggedPostings = includeUntaggedPostings;
    }

    public BookBalance balanceAsOf(String accountCode, String asset, LocalDate asOfDate) {
        if (accountCode == null || accountCode.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Asset is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }
        String normalizedAsset = asset.trim().toUpperCase(Locale.ROOT);

        List<PostingLine> lines = repository.findPostingLines(accountCode, asOfDate);

        BigDecimal balance = BigDecimal.ZERO;
        int postingCount = 0;
        for (PostingLine line : lines) {
            if (!matchesAsset(line, normalizedAsset)) {
                continue;
            }
            balance = balance.add(Amounts.orZero(line.getDebit())).subtract(Amounts.orZero(line.getCredit()));
            postingCount++;
        }

        log.debug("Book balance computed: account={}, asset={}, asOf={}, balance={}, postings={}",
                accountCode, normalizedAsset, asOfDate, balance.toPlainString(), postingCount);

        return new BookBalance(accountCode, normalizedAsset, asOfDate, balance, postingCount);
    }

    private boolean matchesAsset(PostingLine line, String asset) {
        if (line.getAssetTag() == null) {
            return includeUntaggedPostings;
        }
        return asset.equalsIgnoreCase(line.getAssetTag());
    }
}
