package com.flagship.crypto_ledger.lot;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL lot storage using JDBC directly.
 *
 * Database-enforced correctness (see V1__ledger_schema.sql):
 * - remaining_quantity between 0 and original_quantity, and never increased by an update
 * - lot_disposals reject UPDATE and DELETE
 */
@Repository
public class JdbcLotRepository implements LotRepository {

    // Advisory lock namespace for per-asset locks; the ledger uses namespace 1
    static final int ASSET_LOCK_NAMESPACE = 2;

    private static final String LOT_COLUMNS =
        "id, sequence_number, asset, original_quantity, remaining_quantity, cost_basis, remaining_cost_basis, " +
        "acquisition_date, source_type, acquisition_tx_hash, journal_entry_id, fully_disposed, created_at";

    private static final String DISPOSAL_COLUMNS =
        "id, lot_id, asset, acquisition_date, disposal_date, quantity_disposed, proceeds, fee, cost_basis, " +
        "realized_pnl, disposal_tx_hash, journal_entry_id, created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLotRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void lockAsset(String asset) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?, hashtext(?))",
            (ResultSetExtractor<Void>) rs -> null, ASSET_LOCK_NAMESPACE, asset);
    }

    @Override
    public List<Lot> findOpenLotsForUpdate(String asset) {
        return jdbcTemplate.query(
            "SELECT " + LOT_COLUMNS + " FROM lots " +
            "WHERE asset = ? AND fully_disposed = FALSE AND remaining_quantity > 0 " +
            "ORDER BY acquisition_date, sequence_number FOR UPDATE",
            lotRowMapper(),
            asset
        );
    }

    @Override
    public List<Lot> findOpenLots(String asset) {
        return jdbcTemplate.query(
            "SELECT " + LOT_COLUMNS + " FROM lots " +
            "WHERE asset = ? AND fully_disposed = FALSE AND remaining_quantity > 0 " +
            "ORDER BY acquisition_date, sequence_number",
            lotRowMapper(),
            asset
        );
    }

    @Override
    public Optional<Lot> findById(UUID lotId) {
        return jdbcTemplate.query(
            "SELECT " + LOT_COLUMNS + " FROM lots WHERE id = ?",
            lotRowMapper(),
            lotId
        ).stream().findFirst();
    }

    @Override
    public long insert(Lot lot) {
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO lots (id, asset, original_quantity, remaining_quantity, cost_basis, remaining_cost_basis, " +
            "acquisition_date, source_type, acquisition_tx_hash, journal_entry_id, fully_disposed, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            lot.getId(),
            lot.getAsset(),
            lot.getOriginalQuantity(),
            lot.getRemainingQuantity(),
            lot.getCostBasis(),
            lot.getRemainingCostBasis(),
            lot.getAcquisitionDate(),
            lot.getSourceType().name(),
            lot.getAcquisitionTxHash(),
            lot.getJournalEntryId(),
            lot.isFullyDisposed(),
            OffsetDateTime.ofInstant(lot.getCreatedAt(), ZoneOffset.UTC)
        );
        if (sequenceNumber == null) {
            throw new IllegalStateException("No sequence number returned for lot " + lot.getId());
        }
        return sequenceNumber;
    }

    @Override
    public void updateRemaining(Lot lot) {
        int updated = jdbcTemplate.update(
            "UPDATE lots SET remaining_quantity = ?, remaining_cost_basis = ?, fully_disposed = ? WHERE id = ?",
            lot.getRemainingQuantity(),
            lot.getRemainingCostBasis(),
            lot.isFullyDisposed(),
            lot.getId()
        );
        if (updated != 1) {
            throw new IllegalStateException("Lot not found for update: " + lot.getId());
        }
    }

    @Override
    public void insertDisposals(List<LotDisposal> disposals) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO lot_disposals (" + DISPOSAL_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            disposals.stream()
                .map(d -> new Object[] {
                    d.getId(),
                    d.getLotId(),
                    d.getAsset(),
                    d.getAcquisitionDate(),
                    d.getDisposalDate(),
                    d.getQuantityDisposed(),
                    d.getProceeds(),
                    d.getFee(),
                    d.getCostBasis(),
                    d.getRealizedPnL(),
                    d.getDisposalTxHash(),
                    d.getJournalEntryId(),
                    OffsetDateTime.ofInstant(d.getCreatedAt(), ZoneOffset.UTC)
                })
                .toList()
        );
    }

    @Override
    public List<LotDisposal> findDisposalsByLot(UUID lotId) {
        return jdbcTemplate.query(
            "SELECT " + DISPOSAL_COLUMNS + " FROM lot_disposals WHERE lot_id = ? ORDER BY disposal_date, created_at",
            disposalRowMapper(),
            lotId
        );
    }

    @Override
    public List<LotDisposal> findDisposalsBetween(String asset, LocalDate from, LocalDate to) {
        if (asset == null) {
            return jdbcTemplate.query(
                "SELECT " + DISPOSAL_COLUMNS + " FROM lot_disposals " +
                "WHERE disposal_date BETWEEN ? AND ? ORDER BY disposal_date, created_at",
                disposalRowMapper(),
                from,
                to
            );
        }
        return jdbcTemplate.query(
            "SELECT " + DISPOSAL_COLUMNS + " FROM lot_disposals " +
            "WHERE asset = ? AND disposal_date BETWEEN ? AND ? ORDER BY disposal_date, created_at",
            disposalRowMapper(),
            asset,
            from,
            to
        );
    }

    @Override
    public List<String> findAssetsWithOpenLots() {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT asset FROM lots WHERE fully_disposed = FALSE AND remaining_quantity > 0 ORDER BY asset",
            String.class
        );
    }

    private RowMapper<Lot> lotRowMapper() {
        return (rs, rowNum) -> Lot.builder()
            .id(rs.getObject("id", UUID.class))
            .sequenceNumber(rs.getLong("sequence_number"))
            .asset(rs.getString("asset"))
            .originalQuantity(rs.getBigDecimal("original_quantity"))
            .remainingQuantity(rs.getBigDecimal("remaining_quantity"))
            .costBasis(rs.getBigDecimal("cost_basis"))
            .remainingCostBasis(rs.getBigDecimal("remaining_cost_basis"))
            .acquisitionDate(rs.getObject("acquisition_date", LocalDate.class))
            .sourceType(LotSourceType.valueOf(rs.getString("source_type")))
            .acquisitionTxHash(rs.getString("acquisition_tx_hash"))
            .journalEntryId(rs.getObject("journal_entry_id", UUID.class))
            .fullyDisposed(rs.getBoolean("fully_disposed"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
            .build();
    }

    private RowMapper<LotDisposal> disposalRowMapper() {
        return (rs, rowNum) -> LotDisposal.builder()
            .id(rs.getObject("id", UUID.class))
            .lotId(rs.getObject("lot_id", UUID.class))
            .asset(rs.getString("asset"))
            .acquisitionDate(rs.getObject("acquisition_date", LocalDate.class))
            .disposalDate(rs.getObject("disposal_date", LocalDate.class))
            .quantityDisposed(rs.getBigDecimal("quantity_disposed"))
            .proceeds(rs.getBigDecimal("proceeds"))
            .fee(rs.getBigDecimal("fee"))
            .costBasis(rs.getBigDecimal("cost_basis"))
            .realizedPnL(rs.getBigDecimal("realized_pnl"))
            .disposalTxHash(rs.getString("disposal_tx_hash"))
            .journalEntryId(rs.getObject("journal_entry_id", UUID.class))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
            .build();
    }
}
