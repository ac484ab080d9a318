package com.coinledger.ledgerapi.portfolio;

import java.util.List;
import java.util.UUID;

/** Accounts grouped by category; {@code categoryId} is {@code null} for uncategorized accounts. */
public record CategoryValuation(
    UUID categoryId,
    String categoryName,
    ValuationTotals totals,
    List<AccountValuation> accounts) {}
