package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

/** Weighted-average cost basis arithmetic. */
public final class CostBasisCalculator {
  public static final MathContext MATH_CONTEXT = MathContext.DECIMAL128;

  private CostBasisCalculator() {}

  public static HoldingSnapshot apply(
      Holding current, BigDecimal quantityDelta, BigDecimal unitPrice, Instant at) {
    Objects.requireNonNull(current, "current must not be null");
    Objects.requireNonNull(at, "at must not be null");
    if (quantityDelta == null || quantityDelta.signum() == 0) {
      throw new InvalidInputException("quantity delta must be non-zero");
    }
    if (unitPrice != null && unitPrice.signum() < 0) {
      throw new InvalidInputException("unit price must be >= 0");
    }

    BigDecimal q0 = current.quantity();
    BigDecimal c0 = current.avgCostBasis();
    BigDecimal q1 = q0.add(quantityDelta);

    if (quantityDelta.signum() > 0) {
      BigDecimal c1 = unitPrice == null ? c0 : weightedAverage(q0, c0, quantityDelta, unitPrice);
      return new HoldingSnapshot(withPosition(current, q1, c1, at), current, null);
    }

    if (q1.signum() < 0) {
      throw new InsufficientHoldingsException(
          current.accountId(), current.asset(), quantityDelta.negate(), q0);
    }
    BigDecimal realizedGain =
        unitPrice == null ? null : realizedGain(c0, quantityDelta.negate(), unitPrice);
    return new HoldingSnapshot(withPosition(current, q1, c0, at), current, realizedGain);
  }

  public static BigDecimal weightedAverage(
      BigDecimal quantity, BigDecimal avgCost, BigDecimal addedQuantity, BigDecimal unitPrice) {
    BigDecimal totalQuantity = quantity.add(addedQuantity);
    if (totalQuantity.signum() == 0) {
      throw new LedgerArithmeticException("Cannot average cost over a zero quantity");
    }
    BigDecimal totalCost = quantity.multiply(avgCost).add(addedQuantity.multiply(unitPrice));
    return totalCost.divide(totalQuantity, MATH_CONTEXT);
  }

  public static BigDecimal realizedGain(
      BigDecimal avgCost, BigDecimal disposedQuantity, BigDecimal unitPrice) {
    return unitPrice.subtract(avgCost).multiply(disposedQuantity);
  }

  private static Holding withPosition(
      Holding current, BigDecimal quantity, BigDecimal avgCost, Instant at) {
    return new Holding(
        current.accountId(),
        current.asset(),
        quantity,
        avgCost,
        current.costBasisCurrency(),
        at);
  }
}
