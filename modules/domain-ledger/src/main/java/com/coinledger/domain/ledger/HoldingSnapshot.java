package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Holding state after one applied delta, with the state it replaced.
 *
 * @param realizedGain advisory gain or loss for a priced decrease; {@code null} otherwise. Never
 *     persisted.
 */
public record HoldingSnapshot(Holding holding, Holding previous, BigDecimal realizedGain) {
  public HoldingSnapshot {
    Objects.requireNonNull(holding, "holding must not be null");
    Objects.requireNonNull(previous, "previous must not be null");
  }

  public BigDecimal quantityDelta() {
    return holding.quantity().subtract(previous.quantity());
  }
}
