package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.Holding;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record HoldingResponse(
    UUID accountId,
    String asset,
    BigDecimal quantity,
    BigDecimal avgCostBasis,
    String costBasisCurrency,
    BigDecimal costBasisTotal,
    Instant updatedAt) {

  public static HoldingResponse from(Holding holding) {
    return new HoldingResponse(
        holding.accountId(),
        holding.asset(),
        holding.quantity(),
        holding.avgCostBasis(),
        holding.costBasisCurrency(),
        holding.costBasisTotal(),
        holding.updatedAt());
  }
}
