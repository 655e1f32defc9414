package com.flagship.crypto_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the SHA-256 digest that links journal entries into a chain.
 *
 * The digest input is a canonical JSON document: map keys sorted, amounts in
 * scale-independent plain notation, absent optional text as "". Two entries with
 * the same content and the same prevHash therefore always hash identically,
 * regardless of how the amounts were scaled when read back from the database.
 */
@Component
public class EntryHasher {

    public static final String GENESIS_HASH = "0".repeat(64);

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String hash(ValidatedEntry entry, String prevHash) {
        return hash(entry.getDate(), entry.getDescription(), entry.getReference(),
            entry.getPostings(), entry.getMetadata(), prevHash);
    }

    /**
     * Recomputes the digest of a stored entry from its content and stored prevHash.
     */
    public String recompute(JournalEntry entry) {
        return hash(entry.getDate(), entry.getDescription(), entry.getReference(),
            entry.getPostings(), entry.getMetadata(), entry.getPrevHash());
    }

    public String hash(LocalDate date, String description, String reference,
                       List<Posting> postings, Map<String, String> metadata, String prevHash) {
        byte[] payload = canonicalize(date, description, reference, postings, metadata, prevHash);
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    byte[] canonicalize(LocalDate date, String description, String reference,
                        List<Posting> postings, Map<String, String> metadata, String prevHash) {
        Map<String, Object> document = new TreeMap<>();
        document.put("date", date.toString());
        document.put("description", nullToEmpty(description));
        document.put("reference", nullToEmpty(reference));
        document.put("metadata", metadata != null ? new TreeMap<>(metadata) : Map.of());
        document.put("prevHash", nullToEmpty(prevHash));

        List<Map<String, Object>> lines = new ArrayList<>(postings.size());
        for (Posting posting : postings) {
            Map<String, Object> line = new TreeMap<>();
            line.put("line", posting.getLineNumber());
            line.put("account", posting.getAccountCode());
            line.put("debit", Amounts.canonical(posting.getDebit()));
            line.put("credit", Amounts.canonical(posting.getCredit()));
            line.put("desc", nullToEmpty(posting.getDescription()));
            line.put("asset", nullToEmpty(posting.getAssetTag()));
            line.put("dimensions", posting.getDimensions() != null ? new TreeMap<>(posting.getDimensions()) : Map.of());
            lines.add(line);
        }
        document.put("postings", lines);

        try {
            return canonicalMapper.writeValueAsString(document).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entry for hashing", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
