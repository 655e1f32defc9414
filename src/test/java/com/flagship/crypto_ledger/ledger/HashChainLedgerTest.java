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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the hash chain: forks, tampering, appends after a break.
 */
class HashChainLedgerTest {

    private InMemoryJournalEntryRepository repository;
    private HashChainLedger ledger;
    private JournalService journalService;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJournalEntryRepository();
        meterRegistry = new SimpleMeterRegistry();
        ledger = new HashChainLedger(
            repository,
            new EntryHasher(),
            TransactionOperations.withoutTransaction(),
            TransactionOperations.withoutTransaction(),
            new LedgerMetrics(meterRegistry),
            Duration.ofSeconds(5),
            3,
            10_000
        );
        journalService = new JournalService(new PostingValidator(InMemoryAccountDirectory.withDefaultChart()), ledger);
    }

    private JournalEntry append(int n) {
        BigDecimal amount = new BigDecimal(n).add(new BigDecimal("0.5"));
        return journalService.createEntry(JournalEntryDraft.builder()
            .date(LocalDate.of(2024, 1, 1).plusDays(n))
            .description("Deposit " + n)
            .reference("dep-" + n)
            .posting(PostingDraft.debit("1000", amount).withAssetTag("BTC"))
            .posting(PostingDraft.credit("3000", amount))
            .build());
    }

    @Test
    @DisplayName("First entry links to the genesis hash, later entries to their predecessor")
    void testChainLinks() {
        JournalEntry first = append(1);
        JournalEntry second = append(2);

        assertEquals(EntryHasher.GENESIS_HASH, first.getPrevHash());
        assertEquals(first.getHash(), second.getPrevHash());
        assertEquals(1L, first.getSequenceNumber());
        assertEquals(2L, second.getSequenceNumber());
    }

    @Test
    @DisplayName("N appends verify as valid with N entries")
    void testVerifyAfterAppends() {
        // Batch size is 3, so 10 entries take several batches
        for (int i = 0; i < 10; i++) {
            append(i);
        }

        ChainVerification result = ledger.verifyChain();

        assertTrue(result.isValid());
        assertEquals(10, result.getTotalEntries());
        assertNull(result.getBrokenAtEntryId());
        assertEquals(10, ledger.count());
        assertEquals(1.0, meterRegistry.get("ledger.chain.valid").gauge().value());
    }

    @Test
    @DisplayName("Empty chain verifies as valid")
    void testEmptyChain() {
        ChainVerification result = ledger.verifyChain();

        assertTrue(result.isValid());
        assertEquals(0, result.getTotalEntries());
    }

    @Test
    @DisplayName("Tampered content is detected at the tampered entry")
    void testTamperedContentDetected() {
        List<JournalEntry> entries = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            entries.add(append(i));
        }
        JournalEntry victim = entries.get(3);

        // Given: someone rewrote an old description behind the ledger's back
        repository.tamper(victim.getId(), e -> e.toBuilder().description("Deposit 3 (edited)").build());

        // When
        ChainVerification result = ledger.verifyChain();

        // Then
        assertFalse(result.isValid());
        assertEquals(victim.getId(), result.getBrokenAtEntryId());
        assertEquals(3L, result.getBrokenAtIndex());
        assertEquals(6, result.getTotalEntries());
        assertEquals(0.0, meterRegistry.get("ledger.chain.valid").gauge().value());
    }

    @Test
    @DisplayName("Rewritten hash is detected at the next entry's back-link")
    void testTamperedHashDetected() {
        JournalEntry first = append(1);
        JournalEntry second = append(2);
        append(3);

        // A consistent rewrite of entry 1: new content and a matching recomputed hash
        EntryHasher hasher = new EntryHasher();
        repository.tamper(first.getId(), e -> {
            JournalEntry edited = e.toBuilder().description("rewritten").build();
            return edited.toBuilder().hash(hasher.recompute(edited)).build();
        });

        ChainVerification result = ledger.verifyChain();

        assertFalse(result.isValid());
        assertEquals(second.getId(), result.getBrokenAtEntryId());
    }

    @Test
    @DisplayName("A broken chain halts appends until an operator clears it")
    void testHaltAfterBreak() {
        JournalEntry first = append(1);
        repository.tamper(first.getId(), e -> e.toBuilder().reference("forged").build());
        ledger.verifyChain();

        assertTrue(ledger.isHalted());
        ChainIntegrityException e = assertThrows(ChainIntegrityException.class, () -> append(2));
        assertEquals(first.getId(), e.getBrokenAtEntryId());
        assertEquals(1, ledger.count());

        assertTrue(ledger.clearIntegrityHalt("ops@example.com"));
        assertFalse(ledger.isHalted());
        assertFalse(ledger.clearIntegrityHalt("ops@example.com"));
        assertDoesNotThrow(() -> append(2));
    }

    @Test
    @DisplayName("A halt recorded by one ledger instance blocks appends on another sharing the journal")
    void testHaltSharedAcrossInstances() {
        JournalEntry first = append(1);
        repository.tamper(first.getId(), e -> e.toBuilder().description("forged").build());
        ledger.verifyChain();

        // Same storage, fresh process state: nothing carried over in memory
        HashChainLedger restarted = new HashChainLedger(
            repository,
            new EntryHasher(),
            TransactionOperations.withoutTransaction(),
            TransactionOperations.withoutTransaction(),
            new LedgerMetrics(new SimpleMeterRegistry()),
            Duration.ofSeconds(5),
            3,
            10_000
        );
        JournalService restartedJournal = new JournalService(
            new PostingValidator(InMemoryAccountDirectory.withDefaultChart()), restarted);

        assertTrue(restarted.isHalted());
        assertTrue(restarted.getLastVerification().isEmpty());
        ChainIntegrityException e = assertThrows(ChainIntegrityException.class,
            () -> restartedJournal.createEntry(JournalEntryDraft.builder()
                .date(LocalDate.of(2024, 2, 1))
                .description("After restart")
                .posting(PostingDraft.debit("1000", BigDecimal.ONE))
                .posting(PostingDraft.credit("3000", BigDecimal.ONE))
                .build()));
        assertEquals(first.getId(), e.getBrokenAtEntryId());
        assertEquals(1, repository.count());

        assertTrue(restarted.clearIntegrityHalt("ops@example.com"));
        assertFalse(ledger.isHalted());
    }

    @Test
    @DisplayName("A second failed verification keeps the first recorded break")
    void testFirstHaltKept() {
        JournalEntry first = append(1);
        JournalEntry second = append(2);
        repository.tamper(second.getId(), e -> e.toBuilder().description("forged").build());
        ledger.verifyChain();
        repository.tamper(first.getId(), e -> e.toBuilder().description("forged").build());
        ledger.verifyChain();

        ChainIntegrityException e = assertThrows(ChainIntegrityException.class, () -> ledger.assertChainIntact());
        assertEquals(second.getId(), e.getBrokenAtEntryId());
    }

    @Test
    @DisplayName("Rejected drafts write nothing")
    void testRejectedDraftWritesNothing() {
        assertThrows(ImbalancedEntryException.class, () -> journalService.createEntry(JournalEntryDraft.builder()
            .date(LocalDate.of(2024, 1, 1))
            .description("Bad")
            .posting(PostingDraft.debit("1000", BigDecimal.TEN))
            .posting(PostingDraft.credit("3000", BigDecimal.ONE))
            .build()));

        assertEquals(0, ledger.count());
    }

    @Test
    @DisplayName("Concurrent appends never fork the chain")
    void testConcurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int offset = t * perThread;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    append(offset + i);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        List<JournalEntry> all = repository.all();
        assertEquals(threads * perThread, all.size());

        Set<String> prevHashes = new HashSet<>();
        for (JournalEntry entry : all) {
            assertTrue(prevHashes.add(entry.getPrevHash()), "two entries share a predecessor");
        }
        assertTrue(ledger.verifyChain().isValid());
    }

    @Test
    @DisplayName("Proof runs from genesis to the entry and is contiguous")
    void testProofFromGenesis() {
        List<JournalEntry> entries = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            entries.add(append(i));
        }

        HashProof proof = ledger.proof(entries.get(2).getId());

        assertTrue(proof.isFromGenesis());
        assertTrue(proof.isContiguous());
        assertEquals(List.of(entries.get(0).getHash(), entries.get(1).getHash(), entries.get(2).getHash()),
            proof.getHashes());
    }

    @Test
    @DisplayName("Bounded proof covers only the last links")
    void testBoundedProof() {
        List<JournalEntry> entries = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            entries.add(append(i));
        }

        HashProof proof = ledger.proof(entries.get(4).getId(), 2);

        assertFalse(proof.isFromGenesis());
        assertTrue(proof.isContiguous());
        assertEquals(2, proof.getLinks().size());
        assertEquals(entries.get(4).getHash(), proof.getHashes().get(1));
    }

    @Test
    @DisplayName("Proof of an unknown entry is rejected")
    void testProofUnknownEntry() {
        append(1);

        assertThrows(IllegalArgumentException.class, () -> ledger.proof(UUID.randomUUID()));
        assertThrows(IllegalArgumentException.class, () -> ledger.proof(repository.all().get(0).getId(), 0));
    }

    @Test
    @DisplayName("Entries can be found by id and by reference")
    void testLookups() {
        JournalEntry entry = append(7);

        assertEquals(entry.getHash(), ledger.findEntry(entry.getId()).orElseThrow().getHash());
        assertEquals(1, ledger.findByReference("dep-7").size());
        assertTrue(ledger.findByReference("nope").isEmpty());
    }
}
