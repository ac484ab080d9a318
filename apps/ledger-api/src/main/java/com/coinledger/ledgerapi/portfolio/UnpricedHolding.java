package com.coinledger.ledgerapi.portfolio;

import java.math.BigDecimal;
import java.util.UUID;

public record UnpricedHolding(
    UUID accountId, String accountName, String asset, BigDecimal quantity) {}
