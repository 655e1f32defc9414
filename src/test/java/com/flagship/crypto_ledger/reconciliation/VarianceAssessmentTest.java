package com.flagship.crypto_ledger.reconciliation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class VarianceAssessmentTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("0.01");
    private static final BigDecimal ALERT_THRESHOLD = BigDecimal.ONE;

    private static VarianceAssessment assess(String onChain, String book) {
        return VarianceAssessment.assess(new BigDecimal(onChain), new BigDecimal(book), THRESHOLD, ALERT_THRESHOLD);
    }

    @Test
    @DisplayName("105 on-chain vs 100 book: 5% variance, WARNING")
    void testWarning() {
        VarianceAssessment result = assess("105", "100");

        assertEquals(0, new BigDecimal("5").compareTo(result.getVariance()));
        assertEquals(0, new BigDecimal("5").compareTo(result.getVariancePercent()));
        assertFalse(result.isWithinThreshold());
        assertTrue(result.isAlertWorthy());
        assertEquals(AlertSeverity.WARNING, result.getSeverity());
    }

    @Test
    @DisplayName("150 on-chain vs 100 book: 50% variance, CRITICAL")
    void testCriticalFiftyPercent() {
        VarianceAssessment result = assess("150", "100");

        assertEquals(0, new BigDecimal("50").compareTo(result.getVariancePercent()));
        assertEquals(AlertSeverity.CRITICAL, result.getSeverity());
    }

    @Test
    @DisplayName("105 on-chain vs 50 book: 110% variance, CRITICAL")
    void testCriticalAgainstSmallBook() {
        VarianceAssessment result = assess("105", "50");

        assertEquals(0, new BigDecimal("55").compareTo(result.getVariance()));
        assertEquals(0, new BigDecimal("110").compareTo(result.getVariancePercent()));
        assertEquals(AlertSeverity.CRITICAL, result.getSeverity());
    }

    @Test
    @DisplayName("Exactly 10% is still a WARNING")
    void testTenPercentBoundary() {
        assertEquals(AlertSeverity.WARNING, assess("110", "100").getSeverity());
        assertEquals(AlertSeverity.CRITICAL, assess("110.01", "100").getSeverity());
    }

    @Test
    @DisplayName("Book shortfall gives a negative variance")
    void testNegativeVariance() {
        VarianceAssessment result = assess("80", "100");

        assertEquals(0, new BigDecimal("-20").compareTo(result.getVariance()));
        assertEquals(0, new BigDecimal("-20").compareTo(result.getVariancePercent()));
        assertEquals(AlertSeverity.CRITICAL, result.getSeverity());
    }

    @Test
    @DisplayName("Zero book balance: 100% when something is on chain, 0% otherwise")
    void testZeroBook() {
        VarianceAssessment funded = assess("2", "0");
        VarianceAssessment empty = assess("0", "0");

        assertEquals(0, new BigDecimal("100").compareTo(funded.getVariancePercent()));
        assertEquals(AlertSeverity.CRITICAL, funded.getSeverity());
        assertEquals(0, empty.getVariancePercent().signum());
        assertTrue(empty.isWithinThreshold());
        assertNull(empty.getSeverity());
    }

    @Test
    @DisplayName("Variance at the threshold is within it and has no severity")
    void testWithinThreshold() {
        VarianceAssessment result = assess("100.01", "100");

        assertTrue(result.isWithinThreshold());
        assertFalse(result.isAlertWorthy());
        assertNull(result.getSeverity());
    }

    @Test
    @DisplayName("Out of threshold but below the alert threshold is not alert-worthy")
    void testBelowAlertThreshold() {
        VarianceAssessment result = assess("100.5", "100");

        assertFalse(result.isWithinThreshold());
        assertFalse(result.isAlertWorthy());
        assertEquals(AlertSeverity.WARNING, result.getSeverity());
    }

    @Test
    @DisplayName("Percent is rounded to 8 decimal places")
    void testPercentScale() {
        VarianceAssessment result = assess("2", "3");

        assertEquals(8, result.getVariancePercent().scale());
        assertEquals(0, new BigDecimal("-33.33333333").compareTo(result.getVariancePercent()));
    }
}
