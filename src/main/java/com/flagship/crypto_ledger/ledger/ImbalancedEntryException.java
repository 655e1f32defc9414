package com.flagship.crypto_ledger.ledger;

import java.math.BigDecimal;

public class ImbalancedEntryException extends LedgerValidationException {

    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public ImbalancedEntryException(BigDecimal debitTotal, BigDecimal creditTotal) {
        super(String.format("Entry is not balanced: debits=%s, credits=%s, difference=%s",
                debitTotal.toPlainString(), creditTotal.toPlainString(),
                debitTotal.subtract(creditTotal).abs().toPlainString()));
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }

    public ImbalancedEntryException(String message, int postingIndex) {
        super(message, postingIndex);
        this.debitTotal = null;
        this.creditTotal = null;
    }

    public BigDecimal getDebitTotal() {
        return debitTotal;
    }

    public BigDecimal getCreditTotal() {
        return creditTotal;
    }
}
