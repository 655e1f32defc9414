package com.flagship.crypto_ledger.ledger;

import java.util.UUID;

/**
 * Incremental chain check. Entries are fed in sequence order; the first entry whose
 * digest or back-link does not match is remembered and everything after it is only counted.
 * Not thread-safe; one instance per scan.
 */
class ChainVerifier {

    private final EntryHasher hasher;

    private String expectedPrevHash = EntryHasher.GENESIS_HASH;
    private long index;
    private UUID brokenAtEntryId;
    private Long brokenAtIndex;
    private String reason;

    ChainVerifier(EntryHasher hasher) {
        this.hasher = hasher;
    }

    void accept(JournalEntry entry) {
        long position = index++;
        if (brokenAtEntryId != null) {
            return;
        }
        if (!expectedPrevHash.equals(entry.getPrevHash())) {
            markBroken(entry, position, String.format(
                "prevHash %s does not match hash of preceding entry %s", entry.getPrevHash(), expectedPrevHash));
            return;
        }
        String recomputed = hasher.recompute(entry);
        if (!recomputed.equals(entry.getHash())) {
            markBroken(entry, position, String.format(
                "stored hash %s does not match recomputed %s", entry.getHash(), recomputed));
            return;
        }
        expectedPrevHash = entry.getHash();
    }

    ChainVerification result() {
        if (brokenAtEntryId != null) {
            return ChainVerification.broken(index, brokenAtEntryId, brokenAtIndex, reason);
        }
        return ChainVerification.intact(index);
    }

    private void markBroken(JournalEntry entry, long position, String why) {
        this.brokenAtEntryId = entry.getId();
        this.brokenAtIndex = position;
        this.reason = why;
    }
}
