package com.flagship.crypto_ledger.reconciliation;

import com.flagship.crypto_ledger.ledger.BookBalance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine of one wallet-asset pair and its alert latch.
 */
class WalletReconciliationTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("0.01");

    private final UUID walletId = UUID.randomUUID();

    private WalletReconciliation run(WalletReconciliation pair, String onChain, String book) {
        VarianceAssessment assessment = VarianceAssessment.assess(
            new BigDecimal(onChain), new BigDecimal(book), THRESHOLD, BigDecimal.ONE);
        return pair.startRun().record(
            new OnChainBalance("BTC", new BigDecimal(onChain), 800_000L, Instant.parse("2024-06-01T12:00:00Z")),
            new BookBalance("1000", "BTC", LocalDate.of(2024, 6, 1), new BigDecimal(book), 3),
            assessment,
            THRESHOLD);
    }

    private WalletReconciliation fresh() {
        return WalletReconciliation.pending(walletId, "0xabc", "BTC");
    }

    @Test
    @DisplayName("A new pair starts PENDING with the latch unset")
    void testPending() {
        WalletReconciliation pair = fresh();

        assertEquals(ReconciliationStatus.PENDING, pair.getStatus());
        assertFalse(pair.isAlertSent());
        assertNotNull(pair.getId());
    }

    @Test
    @DisplayName("Within threshold ends RECONCILED")
    void testReconciled() {
        WalletReconciliation pair = run(fresh(), "100", "100");

        assertEquals(ReconciliationStatus.RECONCILED, pair.getStatus());
        assertTrue(pair.isWithinThreshold());
        assertFalse(pair.isUnreconciled());
        assertEquals(3, pair.getPostingCount());
        assertEquals(800_000L, pair.getOnChainBlockNumber());
    }

    @Test
    @DisplayName("Out of threshold ends FLAGGED and an alert is due")
    void testFlagged() {
        WalletReconciliation pair = run(fresh(), "105", "100");

        assertEquals(ReconciliationStatus.FLAGGED, pair.getStatus());
        assertTrue(pair.isUnreconciled());
        assertTrue(pair.isAlertDue(VarianceAssessment.assess(
            new BigDecimal("105"), new BigDecimal("100"), THRESHOLD, BigDecimal.ONE)));
        assertEquals(AlertSeverity.WARNING, pair.getSeverity());
    }

    @Test
    @DisplayName("Once alerted, later out-of-threshold runs end ALERTED and no alert is due")
    void testLatchHolds() {
        Instant sentAt = Instant.parse("2024-06-01T12:05:00Z");
        WalletReconciliation alerted = run(fresh(), "105", "100").markAlerted(sentAt);

        assertEquals(ReconciliationStatus.ALERTED, alerted.getStatus());
        assertTrue(alerted.isAlertSent());

        WalletReconciliation rerun = run(alerted, "106", "100");

        assertEquals(ReconciliationStatus.ALERTED, rerun.getStatus());
        assertTrue(rerun.isAlertSent());
        assertEquals(sentAt, rerun.getAlertSentAt());
        assertFalse(rerun.isAlertDue(VarianceAssessment.assess(
            new BigDecimal("106"), new BigDecimal("100"), THRESHOLD, BigDecimal.ONE)));
    }

    @Test
    @DisplayName("A run within threshold clears the latch")
    void testLatchClearsWhenBackInThreshold() {
        WalletReconciliation alerted = run(fresh(), "105", "100").markAlerted(Instant.now());

        WalletReconciliation back = run(alerted, "100", "100");

        assertEquals(ReconciliationStatus.RECONCILED, back.getStatus());
        assertFalse(back.isAlertSent());
        assertNull(back.getAlertSentAt());
        assertEquals(ReconciliationStatus.FLAGGED, run(back, "105", "100").getStatus());
    }

    @Test
    @DisplayName("Resolve clears the latch and records who signed off")
    void testResolve() {
        WalletReconciliation alerted = run(fresh(), "105", "100").markAlerted(Instant.now());

        WalletReconciliation resolved = alerted.resolve("ops@example.com", "Exchange deposit in flight");

        assertEquals(ReconciliationStatus.RECONCILED, resolved.getStatus());
        assertFalse(resolved.isAlertSent());
        assertFalse(resolved.isUnreconciled());
        assertEquals("ops@example.com", resolved.getResolvedBy());
        assertNotNull(resolved.getResolvedAt());
        assertEquals(ReconciliationStatus.FLAGGED, run(resolved, "105", "100").getStatus());

        assertThrows(IllegalArgumentException.class, () -> alerted.resolve(" ", "no operator"));
    }

    @Test
    @DisplayName("Invalid transitions are rejected")
    void testInvalidTransitions() {
        WalletReconciliation reconciled = run(fresh(), "100", "100");
        WalletReconciliation alerted = run(fresh(), "105", "100").markAlerted(Instant.now());

        assertThrows(IllegalStateException.class, () -> reconciled.record(null, null, null, THRESHOLD));
        assertThrows(IllegalStateException.class, () -> reconciled.markAlerted(Instant.now()));
        assertThrows(IllegalStateException.class, () -> alerted.markAlerted(Instant.now()));
    }
}
