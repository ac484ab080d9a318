package com.coinledger.ledgerapi.portfolio;

import java.math.BigDecimal;

public record AssetValuation(String asset, BigDecimal quantity, ValuationTotals totals) {}
