package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record BuyCommand(
    String account,
    String asset,
    BigDecimal quantity,
    BigDecimal unitPrice,
    Instant timestamp,
    String notes,
    String externalId)
    implements TransactionCommand {

  public BuyCommand(String account, String asset, BigDecimal quantity, BigDecimal unitPrice) {
    this(account, asset, quantity, unitPrice, null, null, null);
  }

  @Override
  public TransactionType type() {
    return TransactionType.BUY;
  }
}
