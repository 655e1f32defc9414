package com.flagship.crypto_ledger.ledger;

import java.util.UUID;

/**
 * The hash chain no longer verifies. Indicates tampering or a concurrent-write defect.
 * Never repaired automatically; appends stay halted until an operator clears the condition.
 */
public class ChainIntegrityException extends IllegalStateException {

    private final UUID brokenAtEntryId;

    public ChainIntegrityException(String message, UUID brokenAtEntryId) {
        super(message);
        this.brokenAtEntryId = brokenAtEntryId;
    }

    public UUID getBrokenAtEntryId() {
        return brokenAtEntryId;
    }
}
