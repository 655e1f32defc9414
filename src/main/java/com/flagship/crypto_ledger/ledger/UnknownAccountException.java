package com.flagship.crypto_ledger.ledger;

public class UnknownAccountException extends LedgerValidationException {

    private final String accountCode;

    public UnknownAccountException(String accountCode, Integer postingIndex) {
        super("Account not found: " + accountCode, postingIndex);
        this.accountCode = accountCode;
    }

    public String getAccountCode() {
        return accountCode;
    }
}
