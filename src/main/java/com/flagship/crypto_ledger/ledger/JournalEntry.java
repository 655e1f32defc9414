package com.flagship.crypto_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An immutable, hash-chained journal entry.
 *
 * hash covers date, description, reference, postings, metadata and prevHash
 * (see {@link EntryHasher}); createdAt and sequenceNumber are not hashed.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    Long sequenceNumber;
    LocalDate date;
    String description;
    String reference;
    List<Posting> postings;
    Map<String, String> metadata;
    String hash;
    String prevHash;
    Instant createdAt;

    public ChainLink toLink() {
        return new ChainLink(id, sequenceNumber, hash, prevHash);
    }
}
