package com.coinledger.ledgerapi.portfolio;

import java.util.List;
import java.util.UUID;

public record AccountValuation(
    UUID accountId, String accountName, ValuationTotals totals, List<HoldingValuation> holdings) {}
