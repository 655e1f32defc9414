package com.flagship.crypto_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point conventions shared by the ledger, the lot engine and reconciliation.
 *
 * Amounts are stored as NUMERIC(38,18), so every value that reaches the database
 * must fit in {@link #SCALE} fractional digits.
 */
public final class Amounts {

    public static final int SCALE = 18;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal EPSILON = new BigDecimal("1E-9");
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * True when |a - b| is within {@link #EPSILON}.
     */
    public static boolean nearlyEqual(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(EPSILON) <= 0;
    }

    public static boolean fitsStorageScale(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    /**
     * Scale-independent text form: 24, 24.0 and 24.000000000000000000 all render as "24".
     */
    public static String canonical(BigDecimal value) {
        BigDecimal stripped = orZero(value).stripTrailingZeros();
        return stripped.signum() == 0 ? "0" : stripped.toPlainString();
    }

    /**
     * numerator * multiplier / divisor at storage scale.
     */
    public static BigDecimal prorate(BigDecimal numerator, BigDecimal multiplier, BigDecimal divisor) {
        return numerator.multiply(multiplier).divide(divisor, SCALE, ROUNDING);
    }
}
