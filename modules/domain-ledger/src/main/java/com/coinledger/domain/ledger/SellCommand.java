package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record SellCommand(
    String account,
    String asset,
    BigDecimal quantity,
    BigDecimal unitPrice,
    Instant timestamp,
    String notes,
    String externalId)
    implements TransactionCommand {

  public SellCommand(String account, String asset, BigDecimal quantity, BigDecimal unitPrice) {
    this(account, asset, quantity, unitPrice, null, null, null);
  }

  @Override
  public TransactionType type() {
    return TransactionType.SELL;
  }
}
