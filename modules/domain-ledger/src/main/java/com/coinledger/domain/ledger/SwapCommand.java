package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchanges {@code fromQuantity} of one asset for {@code toQuantity} of another. {@code
 * manualRate}, when given, is in to-units per from-unit and overrides the implied rate.
 */
public record SwapCommand(
    String fromAccount,
    String toAccount,
    String fromAsset,
    BigDecimal fromQuantity,
    String toAsset,
    BigDecimal toQuantity,
    BigDecimal manualRate,
    Instant timestamp,
    String notes,
    String externalId)
    implements TransactionCommand {

  public SwapCommand(
      String account,
      String fromAsset,
      BigDecimal fromQuantity,
      String toAsset,
      BigDecimal toQuantity) {
    this(account, null, fromAsset, fromQuantity, toAsset, toQuantity, null, null, null, null);
  }

  @Override
  public TransactionType type() {
    return TransactionType.SWAP;
  }

  public String targetAccount() {
    return toAccount == null || toAccount.isBlank() ? fromAccount : toAccount;
  }
}
