package com.flagship.crypto_ledger.ledger;

/**
 * A caller-correctable rejection of a journal entry draft.
 * Always raised before anything is written.
 */
public class LedgerValidationException extends IllegalArgumentException {

    private final Integer postingIndex;

    public LedgerValidationException(String message) {
        this(message, null);
    }

    public LedgerValidationException(String message, Integer postingIndex) {
        super(postingIndex == null ? message : String.format("Posting %d: %s", postingIndex, message));
        this.postingIndex = postingIndex;
    }

    /**
     * Zero-based index of the offending posting, or null when the whole entry is at fault.
     */
    public Integer getPostingIndex() {
        return postingIndex;
    }
}
