package com.coinledger.ledgerapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.Map;

/** Current prices per asset code, in the cost-basis currency. */
public record PortfolioValuationRequest(@NotNull Map<String, BigDecimal> prices) {}
