package com.coinledger.ledgerapi.portfolio;

import java.math.BigDecimal;

public record HoldingValuation(
    String asset,
    BigDecimal quantity,
    BigDecimal avgCostBasis,
    BigDecimal price,
    ValuationTotals totals) {}
