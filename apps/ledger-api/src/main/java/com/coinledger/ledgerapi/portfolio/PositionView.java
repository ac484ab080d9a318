package com.coinledger.ledgerapi.portfolio;

import java.math.BigDecimal;
import java.util.UUID;

public record PositionView(
    UUID accountId,
    String accountName,
    UUID categoryId,
    String categoryName,
    String asset,
    BigDecimal quantity,
    BigDecimal avgCostBasis) {}
