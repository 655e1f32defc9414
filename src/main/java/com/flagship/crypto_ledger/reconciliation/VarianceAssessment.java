package com.flagship.crypto_ledger.reconciliation;

import com.flagship.crypto_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Classification of the gap between an on-chain and a book balance.
 *
 * variance = onChain - book
 * variancePercent = variance / book * 100, or 100 when book is zero and onChain is not
 */
@Value
public class VarianceAssessment {

    static final int PERCENT_SCALE = 8;
    static final BigDecimal CRITICAL_PERCENT = BigDecimal.TEN;

    BigDecimal variance;
    BigDecimal variancePercent;
    boolean withinThreshold;
    boolean alertWorthy;
    /** Null when within threshold. */
    AlertSeverity severity;

    public static VarianceAssessment assess(BigDecimal onChainBalance, BigDecimal bookBalance,
                                            BigDecimal threshold, BigDecimal alertThreshold) {
        BigDecimal variance = onChainBalance.subtract(bookBalance);
        BigDecimal variancePercent;
        if (bookBalance.signum() == 0) {
            variancePercent = onChainBalance.signum() != 0 ? Amounts.HUNDRED : BigDecimal.ZERO;
        } else {
            variancePercent = variance.multiply(Amounts.HUNDRED)
                .divide(bookBalance, PERCENT_SCALE, RoundingMode.HALF_EVEN);
        }

        boolean within = variance.abs().compareTo(threshold) <= 0;
        boolean alertWorthy = !within && variance.abs().compareTo(alertThreshold) >= 0;
        AlertSeverity severity = within
            ? null
            : variancePercent.abs().compareTo(CRITICAL_PERCENT) > 0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING;

        return new VarianceAssessment(variance, variancePercent, within, alertWorthy, severity);
    }
}
