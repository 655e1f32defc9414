package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a full scan of the hash chain.
 */
@Value
public class ChainVerification {
    boolean valid;
    long totalEntries;
    UUID brokenAtEntryId;
    Long brokenAtIndex;
    String reason;
    Instant verifiedAt;

    public static ChainVerification intact(long totalEntries) {
        return new ChainVerification(true, totalEntries, null, null, null, Instant.now());
    }

    public static ChainVerification broken(long totalEntries, UUID entryId, long index, String reason) {
        return new ChainVerification(false, totalEntries, entryId, index, reason, Instant.now());
    }
}
