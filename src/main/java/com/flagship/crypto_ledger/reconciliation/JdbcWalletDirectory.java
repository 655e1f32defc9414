package com.flagship.crypto_ledger.reconciliation;

import com.flagship.crypto_ledger.ledger.AccountDirectory;
import com.flagship.crypto_ledger.ledger.UnknownAccountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Wallet accounts over the wallet_accounts table.
 * Tracked assets are stored as a comma-separated, upper-case list.
 */
@Service
@Slf4j
public class JdbcWalletDirectory implements WalletDirectory {

    // Advisory lock namespace for reconciliation runs; keyed by hashtext(wallet id)
    static final int RECONCILIATION_LOCK_NAMESPACE = 3;

    private static final String COLUMNS =
        "id, address, chain, network, label, gl_account_code, tracked_assets, active";

    private final JdbcTemplate jdbcTemplate;
    private final AccountDirectory accountDirectory;

    public JdbcWalletDirectory(JdbcTemplate jdbcTemplate, AccountDirectory accountDirectory) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountDirectory = accountDirectory;
    }

    @Override
    public Optional<WalletAccount> findById(UUID walletAccountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallet_accounts WHERE id = ?",
            walletRowMapper(),
            walletAccountId
        ).stream().findFirst();
    }

    @Override
    public List<WalletAccount> findActive() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM wallet_accounts WHERE active = TRUE ORDER BY created_at, id",
            walletRowMapper()
        );
    }

    @Override
    public void lockForRun(UUID walletAccountId) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?, hashtext(?))",
            (ResultSetExtractor<Void>) rs -> null, RECONCILIATION_LOCK_NAMESPACE, walletAccountId.toString());
    }

    @Override
    public WalletAccount register(String address, String chain, String network, String label,
                                  String glAccountCode, List<String> trackedAssets) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Wallet address is required");
        }
        accountDirectory.resolveAccount(glAccountCode)
            .orElseThrow(() -> new UnknownAccountException(glAccountCode, null));

        List<String> assets = trackedAssets.stream()
            .map(asset -> asset.trim().toUpperCase(Locale.ROOT))
            .distinct()
            .toList();
        WalletAccount wallet = new WalletAccount(
            UUID.randomUUID(),
            address.trim().toLowerCase(Locale.ROOT),
            chain,
            network,
            label,
            glAccountCode,
            assets,
            true
        );

        jdbcTemplate.update(
            "INSERT INTO wallet_accounts (" + COLUMNS + ", created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            wallet.getId(),
            wallet.getAddress(),
            wallet.getChain(),
            wallet.getNetwork(),
            wallet.getLabel(),
            wallet.getGlAccountCode(),
            String.join(",", assets),
            wallet.isActive()
        );
        log.info("Registered wallet account: id={}, address={}, chain={}, glAccount={}",
                wallet.getId(), wallet.getAddress(), chain, glAccountCode);
        return wallet;
    }

    private RowMapper<WalletAccount> walletRowMapper() {
        return (rs, rowNum) -> new WalletAccount(
            rs.getObject("id", UUID.class),
            rs.getString("address"),
            rs.getString("chain"),
            rs.getString("network"),
            rs.getString("label"),
            rs.getString("gl_account_code"),
            splitAssets(rs.getString("tracked_assets")),
            rs.getBoolean("active")
        );
    }

    private static List<String> splitAssets(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(asset -> !asset.isEmpty())
            .toList();
    }
}
