package com.flagship.crypto_ledger.ledger;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for the hash-chained journal. Entries are insert-only.
 *
 * The lock methods must be called inside a transaction; the locks they take are
 * released when that transaction ends.
 */
public interface JournalEntryRepository {

    /**
     * Takes the exclusive append lock and returns the current head of the chain, if any.
     */
    Optional<ChainLink> lockForAppend();

    /**
     * Takes a shared lock that keeps appenders out while a verification scan runs.
     */
    void lockForVerification();

    /**
     * Inserts the entry with its postings and returns the assigned sequence number.
     */
    long insert(JournalEntry entry);

    Optional<JournalEntry> findById(UUID id);

    List<JournalEntry> findByReference(String reference);

    /**
     * Up to {@code limit} entries with a sequence number greater than {@code afterSequence},
     * in sequence order.
     */
    List<JournalEntry> findBatchAfter(long afterSequence, int limit);

    /**
     * The last {@code maxLinks} chain links ending at the given entry, oldest first.
     * Empty when the entry does not exist.
     */
    List<ChainLink> findLinksUpTo(UUID entryId, int maxLinks);

    List<PostingLine> findPostingLines(String accountCode, LocalDate asOfDate);

    long count();

    /**
     * The failed verification that halted appends, if appends are halted.
     */
    Optional<ChainVerification> findIntegrityHalt();

    /**
     * Records a failed verification as the integrity halt unless one is already recorded.
     *
     * @return true if this call recorded the halt
     */
    boolean recordIntegrityHalt(ChainVerification verification);

    /**
     * Removes the integrity halt.
     *
     * @return the halt that was removed, if there was one
     */
    Optional<ChainVerification> clearIntegrityHalt();
}
