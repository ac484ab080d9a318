package com.coinledger.ledgerapi.portfolio;

import java.time.Instant;
import java.util.List;

/**
 * Portfolio-wide valuation. Holdings without a price are listed in {@code unpriced} and left out
 * of every total.
 */
public record PortfolioValuation(
    String costBasisCurrency,
    ValuationTotals totals,
    List<CategoryValuation> categories,
    List<AssetValuation> assets,
    List<UnpricedHolding> unpriced,
    Instant valuedAt) {}
