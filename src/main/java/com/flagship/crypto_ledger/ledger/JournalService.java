package com.flagship.crypto_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry-creation surface of the ledger: validate, then append.
 *
 * When called inside a transaction (a lot disposal journalizing its P&L) the
 * entry commits or rolls back with that transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final PostingValidator postingValidator;
    private final HashChainLedger ledger;

    /**
     * @throws LedgerValidationException if the draft is rejected; nothing is written
     * @throws ChainIntegrityException if appends are halted
     */
    public JournalEntry createEntry(JournalEntryDraft draft) {
        ValidatedEntry validated;
        try {
            validated = postingValidator.validate(draft);
        } catch (LedgerValidationException e) {
            log.warn("Journal entry rejected: reference={}, error={}",
                    draft != null ? draft.getReference() : null, e.getMessage());
            throw e;
        }
        return ledger.append(validated);
    }
}
