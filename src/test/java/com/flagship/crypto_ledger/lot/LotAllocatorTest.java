package com.flagship.crypto_ledger.lot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class LotAllocatorTest {

    private static Lot lot(String quantity, String cost, LocalDate acquired) {
        return Lot.acquire("BTC", new BigDecimal(quantity), new BigDecimal(cost), acquired,
            LotSourceType.PURCHASE, null, null);
    }

    private static BigDecimal sum(List<LotAllocation> allocations, Function<LotAllocation, BigDecimal> field) {
        return allocations.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Test
    @DisplayName("10 @ 10 then 5 @ 12, dispose 12: 10 from the first lot, 2 from the second, cost 124")
    void testFifoScenario() {
        Lot first = lot("10", "100", LocalDate.of(2024, 1, 1));
        Lot second = lot("5", "60", LocalDate.of(2024, 2, 1));

        List<LotAllocation> allocations = LotAllocator.allocate("BTC", List.of(first, second),
            new BigDecimal("12"), new BigDecimal("180"), BigDecimal.ZERO);

        assertEquals(2, allocations.size());
        assertEquals(0, BigDecimal.TEN.compareTo(allocations.get(0).getQuantity()));
        assertEquals(0, new BigDecimal("2").compareTo(allocations.get(1).getQuantity()));
        assertEquals(0, new BigDecimal("100").compareTo(allocations.get(0).getCostBasis()));
        assertEquals(0, new BigDecimal("24").compareTo(allocations.get(1).getCostBasis()));
        assertEquals(0, new BigDecimal("124").compareTo(sum(allocations, LotAllocation::getCostBasis)));

        Lot consumedFirst = allocations.get(0).getConsumedLot();
        Lot consumedSecond = allocations.get(1).getConsumedLot();
        assertTrue(consumedFirst.isFullyDisposed());
        assertEquals(0, consumedFirst.getRemainingCostBasis().signum());
        assertEquals(0, new BigDecimal("3").compareTo(consumedSecond.getRemainingQuantity()));
        assertEquals(0, new BigDecimal("36").compareTo(consumedSecond.getRemainingCostBasis()));
    }

    @Test
    @DisplayName("Proceeds and fee split in proportion and add up exactly")
    void testProceedsAndFeeAddUp() {
        List<Lot> lots = List.of(
            lot("1", "1", LocalDate.of(2024, 1, 1)),
            lot("1", "1", LocalDate.of(2024, 1, 2)),
            lot("1", "1", LocalDate.of(2024, 1, 3)));

        List<LotAllocation> allocations = LotAllocator.allocate("BTC", lots,
            new BigDecimal("3"), new BigDecimal("10"), new BigDecimal("1"));

        assertEquals(0, new BigDecimal("10").compareTo(sum(allocations, LotAllocation::getProceeds)));
        assertEquals(0, BigDecimal.ONE.compareTo(sum(allocations, LotAllocation::getFee)));
        assertEquals(0, new BigDecimal("3.333333333333333333").compareTo(allocations.get(0).getProceeds()));
        assertEquals(0, new BigDecimal("3.333333333333333334").compareTo(allocations.get(2).getProceeds()));
    }

    @Test
    @DisplayName("Realized P&L is proceeds minus fee minus cost")
    void testRealizedPnL() {
        List<LotAllocation> allocations = LotAllocator.allocate("BTC",
            List.of(lot("2", "100", LocalDate.of(2024, 1, 1))),
            BigDecimal.ONE, new BigDecimal("80"), new BigDecimal("5"));

        // 80 - 5 - 50
        assertEquals(0, new BigDecimal("25").compareTo(allocations.get(0).getRealizedPnL()));
    }

    @Test
    @DisplayName("Asking for more than the lots hold fails with requested and available")
    void testInsufficient() {
        InsufficientLotsException e = assertThrows(InsufficientLotsException.class, () -> LotAllocator.allocate("BTC",
            List.of(lot("1.5", "10", LocalDate.of(2024, 1, 1))),
            new BigDecimal("2"), BigDecimal.TEN, BigDecimal.ZERO));

        assertEquals("BTC", e.getAsset());
        assertEquals(0, new BigDecimal("2").compareTo(e.getRequested()));
        assertEquals(0, new BigDecimal("1.5").compareTo(e.getAvailable()));
        assertEquals("Insufficient lots for BTC. Required: 2, Available: 1.5", e.getMessage());
    }

    @Test
    @DisplayName("Closed lots are skipped")
    void testSkipsClosedLots() {
        Lot closed = lot("1", "10", LocalDate.of(2024, 1, 1)).consume(BigDecimal.ONE, BigDecimal.TEN);
        Lot open = lot("1", "20", LocalDate.of(2024, 1, 2));

        List<LotAllocation> allocations = LotAllocator.allocate("BTC", List.of(closed, open),
            BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO);

        assertEquals(1, allocations.size());
        assertEquals(open.getId(), allocations.get(0).getLot().getId());
    }
}
