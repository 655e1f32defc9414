package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.ledger.JournalEntryDraft.PostingDraft;
import com.flagship.crypto_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class BookBalanceCalculatorTest {

    private InMemoryJournalEntryRepository repository;
    private JournalService journalService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJournalEntryRepository();
        HashChainLedger ledger = new HashChainLedger(repository, new EntryHasher(),
            TransactionOperations.withoutTransaction(), TransactionOperations.withoutTransaction(),
            new LedgerMetrics(new SimpleMeterRegistry()), Duration.ofSeconds(5), 500, 10_000);
        journalService = new JournalService(new PostingValidator(InMemoryAccountDirectory.withDefaultChart()), ledger);

        // 1000/BTC: +100 on Jan 1, -40 on Jan 10, +5 on Feb 1
        post(LocalDate.of(2024, 1, 1), PostingDraft.debit("1000", new BigDecimal("100")).withAssetTag("BTC"),
            PostingDraft.credit("3000", new BigDecimal("100")));
        post(LocalDate.of(2024, 1, 10), PostingDraft.debit("1100", new BigDecimal("40")),
            PostingDraft.credit("1000", new BigDecimal("40")).withAssetTag("btc"));
        post(LocalDate.of(2024, 2, 1), PostingDraft.debit("1000", new BigDecimal("5")).withAssetTag("BTC"),
            PostingDraft.credit("3000", new BigDecimal("5")));
        // Other asset and an untagged posting on the same account
        post(LocalDate.of(2024, 1, 5), PostingDraft.debit("1000", new BigDecimal("7")).withAssetTag("ETH"),
            PostingDraft.credit("3000", new BigDecimal("7")));
        post(LocalDate.of(2024, 1, 6), PostingDraft.debit("1000", new BigDecimal("3")),
            PostingDraft.credit("3000", new BigDecimal("3")));
    }

    private void post(LocalDate date, PostingDraft debit, PostingDraft credit) {
        journalService.createEntry(JournalEntryDraft.builder()
            .date(date)
            .description("Test entry")
            .posting(debit)
            .posting(credit)
            .build());
    }

    @Test
    @DisplayName("Balance is debits minus credits for the asset up to the date")
    void testBalanceAsOf() {
        BookBalanceCalculator calculator = new BookBalanceCalculator(repository, false);

        BookBalance balance = calculator.balanceAsOf("1000", "BTC", LocalDate.of(2024, 1, 31));

        assertEquals(0, new BigDecimal("60").compareTo(balance.getBalance()));
        assertEquals(2, balance.getPostingCount());
        assertEquals("BTC", balance.getAsset());
        assertEquals(LocalDate.of(2024, 1, 31), balance.getAsOfDate());
    }

    @Test
    @DisplayName("Postings dated after the as-of date are excluded; the date itself is included")
    void testDateCutoff() {
        BookBalanceCalculator calculator = new BookBalanceCalculator(repository, false);

        assertEquals(0, new BigDecimal("100").compareTo(
            calculator.balanceAsOf("1000", "BTC", LocalDate.of(2024, 1, 9)).getBalance()));
        assertEquals(0, new BigDecimal("65").compareTo(
            calculator.balanceAsOf("1000", "BTC", LocalDate.of(2024, 2, 1)).getBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(
            calculator.balanceAsOf("1000", "BTC", LocalDate.of(2023, 12, 31)).getBalance()));
    }

    @Test
    @DisplayName("Asset match is case-insensitive and other assets are ignored")
    void testAssetFilter() {
        BookBalanceCalculator calculator = new BookBalanceCalculator(repository, false);

        assertEquals(0, new BigDecimal("7").compareTo(
            calculator.balanceAsOf("1000", "eth", LocalDate.of(2024, 12, 31)).getBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(
            calculator.balanceAsOf("1000", "SOL", LocalDate.of(2024, 12, 31)).getBalance()));
    }

    @Test
    @DisplayName("Untagged postings count only when configured")
    void testUntaggedPostings() {
        LocalDate asOf = LocalDate.of(2024, 1, 31);

        BookBalance excluded = new BookBalanceCalculator(repository, false).balanceAsOf("1000", "BTC", asOf);
        BookBalance included = new BookBalanceCalculator(repository, true).balanceAsOf("1000", "BTC", asOf);

        assertEquals(0, new BigDecimal("60").compareTo(excluded.getBalance()));
        assertEquals(0, new BigDecimal("63").compareTo(included.getBalance()));
        assertEquals(3, included.getPostingCount());
    }

    @Test
    @DisplayName("Missing arguments are rejected")
    void testArguments() {
        BookBalanceCalculator calculator = new BookBalanceCalculator(repository, false);

        assertThrows(IllegalArgumentException.class, () -> calculator.balanceAsOf(null, "BTC", LocalDate.now()));
        assertThrows(IllegalArgumentException.class, () -> calculator.balanceAsOf("1000", " ", LocalDate.now()));
        assertThrows(IllegalArgumentException.class, () -> calculator.balanceAsOf("1000", "BTC", null));
    }
}
