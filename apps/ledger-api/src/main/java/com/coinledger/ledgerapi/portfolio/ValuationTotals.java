package com.coinledger.ledgerapi.portfolio;

import com.coinledger.domain.ledger.CostBasisCalculator;
import java.math.BigDecimal;

/**
 * Value, cost and unrealized profit of a group of holdings.
 *
 * @param pnlPercent {@code pnl / cost * 100}; zero when there is no cost
 */
public record ValuationTotals(
    BigDecimal value, BigDecimal cost, BigDecimal pnl, BigDecimal pnlPercent) {
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public static final ValuationTotals ZERO = of(BigDecimal.ZERO, BigDecimal.ZERO);

  public static ValuationTotals of(BigDecimal value, BigDecimal cost) {
    BigDecimal pnl = value.subtract(cost);
    BigDecimal pnlPercent =
        cost.signum() == 0
            ? BigDecimal.ZERO
            : pnl.divide(cost, CostBasisCalculator.MATH_CONTEXT).multiply(HUNDRED);
    return new ValuationTotals(value, cost, pnl, pnlPercent);
  }

  public ValuationTotals plus(ValuationTotals other) {
    return of(value.add(other.value), cost.add(other.cost));
  }
}
