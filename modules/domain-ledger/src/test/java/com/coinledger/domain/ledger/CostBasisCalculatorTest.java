package com.coinledger.domain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CostBasisCalculatorTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private final UUID accountId = UUID.randomUUID();

  @Test
  void shouldWeightAverageCostAcrossBuys() {
    Holding first = buy(Holding.empty(accountId, "BTC", "USD"), "0.1", "50000");
    Holding second = buy(first, "0.1", "60000");

    assertEquals(0, new BigDecimal("0.2").compareTo(second.quantity()));
    assertEquals(0, new BigDecimal("55000").compareTo(second.avgCostBasis()));
  }

  @Test
  void shouldProduceSameAverageRegardlessOfBuyOrder() {
    Holding forward = buy(buy(Holding.empty(accountId, "ETH", "USD"), "2", "1800"), "3", "2100");
    Holding reverse = buy(buy(Holding.empty(accountId, "ETH", "USD"), "3", "2100"), "2", "1800");

    assertEquals(0, forward.avgCostBasis().compareTo(reverse.avgCostBasis()));
    assertEquals(0, new BigDecimal("1980").compareTo(forward.avgCostBasis()));
  }

  @Test
  void shouldKeepAverageCostOnSellAndReportAdvisoryGain() {
    Holding held = holding("0.2", "55000");

    HoldingSnapshot snapshot =
        CostBasisCalculator.apply(held, new BigDecimal("-0.05"), new BigDecimal("70000"), NOW);

    assertEquals(0, new BigDecimal("0.15").compareTo(snapshot.holding().quantity()));
    assertEquals(0, new BigDecimal("55000").compareTo(snapshot.holding().avgCostBasis()));
    assertEquals(0, new BigDecimal("750").compareTo(snapshot.realizedGain()));
    assertEquals(0, new BigDecimal("-0.05").compareTo(snapshot.quantityDelta()));
  }

  @Test
  void shouldAllowSellingEntirePosition() {
    Holding held = holding("0.2", "55000");

    HoldingSnapshot snapshot =
        CostBasisCalculator.apply(held, new BigDecimal("-0.2"), new BigDecimal("40000"), NOW);

    assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.holding().quantity()));
    assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.holding().costBasisTotal()));
    assertEquals(0, new BigDecimal("-3000").compareTo(snapshot.realizedGain()));
  }

  @Test
  void shouldIgnoreStaleAverageWhenRebuyingFromZero() {
    Holding emptied = holding("0", "55000");

    Holding rebought = buy(emptied, "1", "100");

    assertEquals(0, new BigDecimal("100").compareTo(rebought.avgCostBasis()));
  }

  @Test
  void shouldPreserveAverageOnUnpricedIncrease() {
    Holding held = holding("1", "2000");

    HoldingSnapshot snapshot = CostBasisCalculator.apply(held, BigDecimal.ONE, null, NOW);

    assertEquals(0, new BigDecimal("2").compareTo(snapshot.holding().quantity()));
    assertEquals(0, new BigDecimal("2000").compareTo(snapshot.holding().avgCostBasis()));
    assertNull(snapshot.realizedGain());
  }

  @Test
  void shouldRejectOverdraw() {
    Holding held = holding("0.2", "55000");

    InsufficientHoldingsException ex =
        assertThrows(
            InsufficientHoldingsException.class,
            () -> CostBasisCalculator.apply(held, new BigDecimal("-1"), null, NOW));

    assertEquals(LedgerErrorCode.INSUFFICIENT_HOLDINGS, ex.code());
    assertEquals(0, BigDecimal.ONE.compareTo(ex.requested()));
    assertEquals(0, new BigDecimal("0.2").compareTo(ex.available()));
  }

  @Test
  void shouldRejectZeroDeltaAndNegativePrice() {
    Holding held = holding("1", "10");

    assertThrows(
        InvalidInputException.class,
        () -> CostBasisCalculator.apply(held, BigDecimal.ZERO, null, NOW));
    assertThrows(
        InvalidInputException.class,
        () -> CostBasisCalculator.apply(held, BigDecimal.ONE, new BigDecimal("-1"), NOW));
  }

  private Holding holding(String quantity, String avgCost) {
    return new Holding(
        accountId, "BTC", new BigDecimal(quantity), new BigDecimal(avgCost), "USD", NOW);
  }

  private Holding buy(Holding current, String quantity, String price) {
    return CostBasisCalculator.apply(
            current, new BigDecimal(quantity), new BigDecimal(price), NOW)
        .holding();
  }
}
