package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Holding(
    UUID accountId,
    String asset,
    BigDecimal quantity,
    BigDecimal avgCostBasis,
    String costBasisCurrency,
    Instant updatedAt) {

  public Holding {
    Objects.requireNonNull(accountId, "accountId must not be null");
    asset = Currency.normalizeCode(asset);
    Objects.requireNonNull(quantity, "quantity must not be null");
    Objects.requireNonNull(avgCostBasis, "avgCostBasis must not be null");
    costBasisCurrency = Currency.normalizeCode(costBasisCurrency);
    if (quantity.signum() < 0) {
      throw new InvalidInputException("quantity must be >= 0");
    }
    if (avgCostBasis.signum() < 0) {
      throw new InvalidInputException("avgCostBasis must be >= 0");
    }
  }

  public static Holding empty(UUID accountId, String asset, String costBasisCurrency) {
    return new Holding(
        accountId, asset, BigDecimal.ZERO, BigDecimal.ZERO, costBasisCurrency, null);
  }

  public boolean isEmpty() {
    return quantity.signum() == 0;
  }

  /** Total cost of the held quantity; zero when nothing is held. */
  public BigDecimal costBasisTotal() {
    if (isEmpty()) {
      return BigDecimal.ZERO;
    }
    return quantity.multiply(avgCostBasis);
  }
}
