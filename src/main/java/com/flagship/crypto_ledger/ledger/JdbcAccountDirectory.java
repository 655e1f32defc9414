package com.flagship.crypto_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Account and dimension lookups over the chart-of-accounts tables.
 * The registration methods are used for seeding and tests; the chart itself is owned elsewhere.
 */
@Service
public class JdbcAccountDirectory implements AccountDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Account> resolveAccount(String code) {
        return jdbcTemplate.query(
            "SELECT code, name, account_type FROM accounts WHERE code = ?",
            (rs, rowNum) -> new Account(
                rs.getString("code"),
                rs.getString("name"),
                Account.AccountType.valueOf(rs.getString("account_type"))
            ),
            code
        ).stream().findFirst();
    }

    @Override
    public Optional<DimensionValue> resolveDimensionValue(String dimensionCode, String valueCode) {
        return jdbcTemplate.query(
            "SELECT dimension_code, code, name FROM dimension_values WHERE dimension_code = ? AND code = ?",
            (rs, rowNum) -> new DimensionValue(
                rs.getString("dimension_code"),
                rs.getString("code"),
                rs.getString("name")
            ),
            dimensionCode,
            valueCode
        ).stream().findFirst();
    }

    public Account createAccount(String code, String name, Account.AccountType accountType) {
        jdbcTemplate.update(
            "INSERT INTO accounts (code, name, account_type, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            code,
            name,
            accountType.name()
        );
        return new Account(code, name, accountType);
    }

    public void registerDimension(String dimensionCode, String name) {
        jdbcTemplate.update(
            "INSERT INTO dimensions (code, name, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            dimensionCode,
            name
        );
    }

    public DimensionValue createDimensionValue(String dimensionCode, String valueCode, String name) {
        jdbcTemplate.update(
            "INSERT INTO dimension_values (dimension_code, code, name, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            dimensionCode,
            valueCode,
            name
        );
        return new DimensionValue(dimensionCode, valueCode, name);
    }
}
