package com.flagship.crypto_ledger.lot;

/**
 * Order in which open lots are consumed by a disposal.
 */
public enum DisposalMethod {
    /** Oldest acquisition first. */
    FIFO,
    /** Newest acquisition first. */
    LIFO,
    /** Explicitly chosen lots, consumed in the order given. */
    SPECIFIC
}
