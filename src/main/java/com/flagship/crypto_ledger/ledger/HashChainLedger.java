package com.flagship.crypto_ledger.ledger;

import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, SHA-256 hash-chained journal.
 *
 * Key principles:
 * - One writer at a time: an in-process write lock plus a PostgreSQL advisory lock,
 *   both held until the appending transaction completes
 * - Each entry's prevHash is the hash of the entry appended before it
 *   (the genesis value for the first entry), so UNIQUE(prev_hash) rules out forks
 * - Verification takes the shared side of both locks: readers run together, writers wait
 * - A failed verification halts appends until an operator clears it. The halt is
 *   stored with the journal and re-checked under the append lock, so it holds
 *   across restarts and instances
 *
 * Lock waits are bounded; a timeout surfaces as {@link CannotAcquireLockException}
 * and the caller may retry. A caller whose append timed out after it was sent can
 * check {@link #findByReference} before retrying.
 */
@Service
@Slf4j
public class HashChainLedger {

    private final JournalEntryRepository repository;
    private final EntryHasher hasher;
    private final TransactionOperations writeTransactions;
    private final TransactionOperations snapshotTransactions;
    private final LedgerMetrics metrics;
    private final Duration lockTimeout;
    private final int verifyBatchSize;
    private final int maxProofLinks;

    private final ReentrantReadWriteLock chainLock = new ReentrantReadWriteLock(true);
    private volatile ChainVerification lastVerification;

    public HashChainLedger(JournalEntryRepository repository,
                           EntryHasher hasher,
                           @Qualifier("ledgerWriteTransactions") TransactionOperations writeTransactions,
                           @Qualifier("ledgerSnapshotTransactions") TransactionOperations snapshotTransactions,
                           LedgerMetrics metrics,
                           @Value("${ledger.append.lock-timeout:5s}") Duration lockTimeout,
                           @Value("${ledger.verify.batch-size:500}") int verifyBatchSize,
                           @Value("${ledger.proof.max-links:10000}") int maxProofLinks) {
        if (verifyBatchSize <= 0) {
            throw new IllegalArgumentException("ledger.verify.batch-size must be positive");
        }
        this.repository = repository;
        this.hasher = hasher;
        this.writeTransactions = writeTransactions;
        this.snapshotTransactions = snapshotTransactions;
        this.metrics = metrics;
        this.lockTimeout = lockTimeout;
        this.verifyBatchSize = verifyBatchSize;
        this.maxProofLinks = maxProofLinks;
    }

    /**
     * Appends a validated entry to the end of the chain.
     *
     * Inside an active transaction the append joins it, and the write lock is
     * released only after that transaction commits or rolls back. Otherwise the
     * append runs in its own transaction.
     *
     * @throws ChainIntegrityException if appends are halted
     * @throws CannotAcquireLockException if the write lock was not obtained in time
     */
    public JournalEntry append(ValidatedEntry entry) {
        long startTime = System.currentTimeMillis();
        Lock writeLock = chainLock.writeLock();
        acquire(writeLock, "append");

        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            JournalEntry stored;
            if (TransactionSynchronizationManager.isActualTransactionActive()
                    && TransactionSynchronizationManager.isSynchronizationActive()) {
                try {
                    stored = insertAtHead(entry);
                    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                        @Override
                        public void afterCompletion(int status) {
                            writeLock.unlock();
                        }
                    });
                } catch (RuntimeException e) {
                    writeLock.unlock();
                    throw e;
                }
            } else {
                try {
                    stored = writeTransactions.execute(status -> insertAtHead(entry));
                } finally {
                    writeLock.unlock();
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryAppended("success");
            metrics.recordLatency("append", duration);
            return stored;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryAppended("error");
            metrics.recordLatency("append", duration);
            log.error("Journal append failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        }
    }

    private JournalEntry insertAtHead(ValidatedEntry entry) {
        Optional<ChainLink> head = repository.lockForAppend();
        repository.findIntegrityHalt().ifPresent(halt -> {
            throw halted(halt);
        });
        String prevHash = head
            .map(ChainLink::getHash)
            .orElse(EntryHasher.GENESIS_HASH);

        UUID entryId = UUID.randomUUID();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            JournalEntry candidate = JournalEntry.builder()
                .id(entryId)
                .date(entry.getDate())
                .description(entry.getDescription())
                .reference(entry.getReference())
                .postings(entry.getPostings())
                .metadata(entry.getMetadata())
                .prevHash(prevHash)
                .hash(hasher.hash(entry, prevHash))
                .createdAt(Instant.now())
                .build();

            long sequenceNumber = repository.insert(candidate);
            JournalEntry stored = candidate.toBuilder().sequenceNumber(sequenceNumber).build();

            log.info("Journal entry appended: seq={}, hash={}, prevHash={}, postings={}",
                    sequenceNumber, stored.getHash(), prevHash, stored.getPostings().size());
            return stored;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Recomputes every digest and checks every back-link, oldest entry first.
     * Read-only; a broken chain halts further appends.
     */
    public ChainVerification verifyChain() {
        long startTime = System.currentTimeMillis();
        Lock readLock = chainLock.readLock();
        acquire(readLock, "verify");

        ChainVerification result;
        try {
            result = snapshotTransactions.execute(status -> {
                repository.lockForVerification();
                ChainVerifier verifier = new ChainVerifier(hasher);
                long afterSequence = 0L;
                List<JournalEntry> batch;
                do {
                    batch = repository.findBatchAfter(afterSequence, verifyBatchSize);
                    for (JournalEntry entry : batch) {
                        verifier.accept(entry);
                        afterSequence = entry.getSequenceNumber();
                    }
                } while (batch.size() == verifyBatchSize);
                return verifier.result();
            });
        } finally {
            readLock.unlock();
        }

        lastVerification = result;
        metrics.recordChainVerification(result);
        metrics.recordLatency("verify", System.currentTimeMillis() - startTime);

        if (result.isValid()) {
            log.info("Hash chain verified: entries={}", result.getTotalEntries());
        } else if (Boolean.TRUE.equals(writeTransactions.execute(status -> repository.recordIntegrityHalt(result)))) {
            log.error("Hash chain broken, halting appends: entryId={}, index={}, reason={}",
                    result.getBrokenAtEntryId(), result.getBrokenAtIndex(), result.getReason());
        }
        return result;
    }

    /**
     * Chain links from genesis (or from the start of the default window) to the entry.
     */
    public HashProof proof(UUID entryId) {
        return proof(entryId, maxProofLinks);
    }

    /**
     * The last {@code maxLinks} chain links ending at the entry, oldest first.
     *
     * @throws IllegalArgumentException if the entry does not exist or maxLinks is not positive
     */
    public HashProof proof(UUID entryId, int maxLinks) {
        if (maxLinks <= 0) {
            throw new IllegalArgumentException("maxLinks must be positive: " + maxLinks);
        }
        List<ChainLink> links = snapshotTransactions.execute(status -> repository.findLinksUpTo(entryId, maxLinks));
        if (links == null || links.isEmpty()) {
            throw new IllegalArgumentException("Journal entry not found: " + entryId);
        }
        boolean fromGenesis = EntryHasher.GENESIS_HASH.equals(links.get(0).getPrevHash());
        return new HashProof(entryId, List.copyOf(links), fromGenesis);
    }

    public Optional<JournalEntry> findEntry(UUID entryId) {
        return repository.findById(entryId);
    }

    public List<JournalEntry> findByReference(String reference) {
        return repository.findByReference(reference);
    }

    public long count() {
        return repository.count();
    }

    /**
     * @throws ChainIntegrityException while a broken chain has not been cleared
     */
    public void assertChainIntact() {
        repository.findIntegrityHalt().ifPresent(halt -> {
            throw halted(halt);
        });
    }

    /**
     * Lifts an integrity halt after an operator has investigated the break.
     *
     * @return true if a halt was in place
     */
    public boolean clearIntegrityHalt(String operator) {
        Optional<ChainVerification> cleared = writeTransactions.execute(status -> repository.clearIntegrityHalt());
        if (cleared == null || cleared.isEmpty()) {
            return false;
        }
        log.warn("Integrity halt cleared: operator={}, brokenAtEntryId={}, reason={}",
                operator, cleared.get().getBrokenAtEntryId(), cleared.get().getReason());
        return true;
    }

    public boolean isHalted() {
        return repository.findIntegrityHalt().isPresent();
    }

    public Optional<ChainVerification> getLastVerification() {
        return Optional.ofNullable(lastVerification);
    }

    private static ChainIntegrityException halted(ChainVerification halt) {
        return new ChainIntegrityException(String.format(
            "Ledger appends are halted: chain broken at entry %s (%s)",
            halt.getBrokenAtEntryId(), halt.getReason()), halt.getBrokenAtEntryId());
    }

    private void acquire(Lock lock, String lockName) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                metrics.recordLockTimeout(lockName);
                throw new CannotAcquireLockException(String.format(
                    "Timed out after %dms waiting for the ledger %s lock", lockTimeout.toMillis(), lockName));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("Interrupted while waiting for the ledger " + lockName + " lock", e);
        }
    }
}
