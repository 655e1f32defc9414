package com.flagship.crypto_ledger.ledger;

import lombok.Value;

/**
 * A general-ledger account as resolved from the account directory.
 * Balances are never stored on the account; they are derived from postings.
 */
@Value
public class Account {
    String code;
    String name;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        INCOME,
        EXPENSE
    }
}
