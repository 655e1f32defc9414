package com.flagship.crypto_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * PostgreSQL journal storage using JDBC directly.
 *
 * Database-enforced correctness (see V1__ledger_schema.sql):
 * - journal_entries, postings and posting_dimensions reject UPDATE and DELETE
 * - a deferred constraint trigger rejects unbalanced entries at commit
 * - UNIQUE(prev_hash) makes a forked chain impossible to commit
 *
 * The integrity halt is a single row in ledger_integrity_halt, so it survives
 * restarts and is seen by every instance.
 */
@Repository
public class JdbcJournalEntryRepository implements JournalEntryRepository {

    // Advisory lock key (namespace, id) guarding the chain head
    static final int LEDGER_LOCK_NAMESPACE = 1;
    static final int LEDGER_LOCK_ID = 0;

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String ENTRY_COLUMNS =
        "e.id, e.sequence_number, e.entry_date, e.description, e.reference, e.metadata, " +
        "e.hash, e.prev_hash, e.created_at";

    private static final String HALT_COLUMNS =
        "total_entries, broken_at_entry_id, broken_at_index, reason, detected_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcJournalEntryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ChainLink> lockForAppend() {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?, ?)",
            (ResultSetExtractor<Void>) rs -> null, LEDGER_LOCK_NAMESPACE, LEDGER_LOCK_ID);

        List<ChainLink> head = jdbcTemplate.query(
            "SELECT id, sequence_number, hash, prev_hash FROM journal_entries " +
            "ORDER BY sequence_number DESC LIMIT 1",
            chainLinkRowMapper()
        );
        return head.stream().findFirst();
    }

    @Override
    public void lockForVerification() {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock_shared(?, ?)",
            (ResultSetExtractor<Void>) rs -> null, LEDGER_LOCK_NAMESPACE, LEDGER_LOCK_ID);
    }

    @Override
    public long insert(JournalEntry entry) {
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO journal_entries (id, entry_date, description, reference, metadata, hash, prev_hash, created_at) " +
            "VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            entry.getId(),
            entry.getDate(),
            entry.getDescription(),
            entry.getReference(),
            writeMetadata(entry.getMetadata()),
            entry.getHash(),
            entry.getPrevHash(),
            OffsetDateTime.ofInstant(entry.getCreatedAt(), ZoneOffset.UTC)
        );

        List<Object[]> postingRows = new ArrayList<>();
        List<Object[]> dimensionRows = new ArrayList<>();
        for (Posting posting : entry.getPostings()) {
            postingRows.add(new Object[] {
                entry.getId(),
                posting.getLineNumber(),
                posting.getAccountCode(),
                posting.getDebit(),
                posting.getCredit(),
                posting.getDescription(),
                posting.getAssetTag()
            });
            posting.getDimensions().forEach((dimension, value) -> dimensionRows.add(new Object[] {
                entry.getId(), posting.getLineNumber(), dimension, value
            }));
        }

        jdbcTemplate.batchUpdate(
            "INSERT INTO postings (entry_id, line_number, account_code, debit, credit, description, asset_tag) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            postingRows
        );
        if (!dimensionRows.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO posting_dimensions (entry_id, line_number, dimension_code, value_code) VALUES (?, ?, ?, ?)",
                dimensionRows
            );
        }

        if (sequenceNumber == null) {
            throw new IllegalStateException("No sequence number returned for entry " + entry.getId());
        }
        return sequenceNumber;
    }

    @Override
    public Optional<JournalEntry> findById(UUID id) {
        return loadEntries("e.id = ?", id).stream().findFirst();
    }

    @Override
    public List<JournalEntry> findByReference(String reference) {
        return loadEntries("e.reference = ?", reference);
    }

    @Override
    public List<JournalEntry> findBatchAfter(long afterSequence, int limit) {
        Long upperBound = jdbcTemplate.queryForObject(
            "SELECT MAX(sequence_number) FROM (" +
            "  SELECT sequence_number FROM journal_entries WHERE sequence_number > ? " +
            "  ORDER BY sequence_number LIMIT ?) batch",
            Long.class,
            afterSequence,
            limit
        );
        if (upperBound == null) {
            return List.of();
        }
        return loadEntries("e.sequence_number > ? AND e.sequence_number <= ?", afterSequence, upperBound);
    }

    @Override
    public List<ChainLink> findLinksUpTo(UUID entryId, int maxLinks) {
        List<ChainLink> newestFirst = jdbcTemplate.query(
            "SELECT id, sequence_number, hash, prev_hash FROM journal_entries " +
            "WHERE sequence_number <= (SELECT sequence_number FROM journal_entries WHERE id = ?) " +
            "ORDER BY sequence_number DESC LIMIT ?",
            chainLinkRowMapper(),
            entryId,
            maxLinks
        );
        List<ChainLink> links = new ArrayList<>(newestFirst);
        Collections.reverse(links);
        return links;
    }

    @Override
    public List<PostingLine> findPostingLines(String accountCode, LocalDate asOfDate) {
        return jdbcTemplate.query(
            "SELECT p.entry_id, e.entry_date, p.account_code, p.debit, p.credit, p.asset_tag " +
            "FROM postings p JOIN journal_entries e ON e.id = p.entry_id " +
            "WHERE p.account_code = ? AND e.entry_date <= ? " +
            "ORDER BY e.sequence_number, p.line_number",
            (rs, rowNum) -> new PostingLine(
                rs.getObject("entry_id", UUID.class),
                rs.getObject("entry_date", LocalDate.class),
                rs.getString("account_code"),
                rs.getBigDecimal("debit"),
                rs.getBigDecimal("credit"),
                rs.getString("asset_tag")
            ),
            accountCode,
            asOfDate
        );
    }

    @Override
    public Optional<ChainVerification> findIntegrityHalt() {
        return jdbcTemplate.query(
            "SELECT " + HALT_COLUMNS + " FROM ledger_integrity_halt",
            haltRowMapper()
        ).stream().findFirst();
    }

    @Override
    public boolean recordIntegrityHalt(ChainVerification verification) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_integrity_halt (id, total_entries, broken_at_entry_id, broken_at_index, reason, detected_at) " +
            "VALUES (1, ?, ?, ?, ?, ?) ON CONFLICT (id) DO NOTHING",
            verification.getTotalEntries(),
            verification.getBrokenAtEntryId(),
            verification.getBrokenAtIndex(),
            verification.getReason(),
            OffsetDateTime.ofInstant(verification.getVerifiedAt(), ZoneOffset.UTC)
        );
        return inserted == 1;
    }

    @Override
    public Optional<ChainVerification> clearIntegrityHalt() {
        return jdbcTemplate.query(
            "DELETE FROM ledger_integrity_halt RETURNING " + HALT_COLUMNS,
            haltRowMapper()
        ).stream().findFirst();
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM journal_entries", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Loads entries matching a predicate on alias "e", with their postings and dimension tags.
     */
    private List<JournalEntry> loadEntries(String predicate, Object... args) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries e WHERE " + predicate +
            " ORDER BY e.sequence_number",
            entryHeaderRowMapper(),
            args
        );
        if (headers.isEmpty()) {
            return headers;
        }

        Map<UUID, Map<Integer, Map<String, String>>> dimensions = new HashMap<>();
        jdbcTemplate.query(
            "SELECT d.entry_id, d.line_number, d.dimension_code, d.value_code " +
            "FROM posting_dimensions d JOIN journal_entries e ON e.id = d.entry_id WHERE " + predicate,
            rs -> {
                dimensions
                    .computeIfAbsent(rs.getObject("entry_id", UUID.class), k -> new HashMap<>())
                    .computeIfAbsent(rs.getInt("line_number"), k -> new TreeMap<>())
                    .put(rs.getString("dimension_code"), rs.getString("value_code"));
            },
            args
        );

        Map<UUID, List<Posting>> postings = new HashMap<>();
        jdbcTemplate.query(
            "SELECT p.entry_id, p.line_number, p.account_code, p.debit, p.credit, p.description, p.asset_tag " +
            "FROM postings p JOIN journal_entries e ON e.id = p.entry_id WHERE " + predicate +
            " ORDER BY e.sequence_number, p.line_number",
            rs -> {
                UUID entryId = rs.getObject("entry_id", UUID.class);
                int lineNumber = rs.getInt("line_number");
                Map<String, String> tags = dimensions
                    .getOrDefault(entryId, Map.of())
                    .getOrDefault(lineNumber, Map.of());
                postings.computeIfAbsent(entryId, k -> new ArrayList<>()).add(new Posting(
                    lineNumber,
                    rs.getString("account_code"),
                    rs.getBigDecimal("debit"),
                    rs.getBigDecimal("credit"),
                    rs.getString("description"),
                    rs.getString("asset_tag"),
                    Collections.unmodifiableMap(tags)
                ));
            },
            args
        );

        return headers.stream()
            .map(header -> header.toBuilder()
                .postings(List.copyOf(postings.getOrDefault(header.getId(), List.of())))
                .build())
            .toList();
    }

    private RowMapper<ChainVerification> haltRowMapper() {
        return (rs, rowNum) -> new ChainVerification(
            false,
            rs.getLong("total_entries"),
            rs.getObject("broken_at_entry_id", UUID.class),
            rs.getObject("broken_at_index", Long.class),
            rs.getString("reason"),
            rs.getObject("detected_at", OffsetDateTime.class).toInstant()
        );
    }

    private RowMapper<JournalEntry> entryHeaderRowMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .sequenceNumber(rs.getLong("sequence_number"))
            .date(rs.getObject("entry_date", LocalDate.class))
            .description(rs.getString("description"))
            .reference(rs.getString("reference"))
            .metadata(readMetadata(rs))
            .hash(rs.getString("hash"))
            .prevHash(rs.getString("prev_hash"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
            .postings(List.of())
            .build();
    }

    private RowMapper<ChainLink> chainLinkRowMapper() {
        return (rs, rowNum) -> new ChainLink(
            rs.getObject("id", UUID.class),
            rs.getLong("sequence_number"),
            rs.getString("hash"),
            rs.getString("prev_hash")
        );
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize entry metadata", e);
        }
    }

    private Map<String, String> readMetadata(ResultSet rs) throws SQLException {
        String json = rs.getString("metadata");
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(new TreeMap<>(objectMapper.readValue(json, METADATA_TYPE)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt metadata JSON on journal entry", e);
        }
    }
}
