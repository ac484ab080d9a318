package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Moves {@code quantity} of {@code asset} between two accounts. The fee is deducted from the
 * transferred quantity; {@code feeAsset} defaults to {@code asset}.
 */
public record TransferCommand(
    String fromAccount,
    String toAccount,
    String asset,
    BigDecimal quantity,
    BigDecimal fee,
    String feeAsset,
    Instant timestamp,
    String notes,
    String externalId)
    implements TransactionCommand {

  public TransferCommand(String fromAccount, String toAccount, String asset, BigDecimal quantity) {
    this(fromAccount, toAccount, asset, quantity, null, null, null, null, null);
  }

  @Override
  public TransactionType type() {
    return TransactionType.TRANSFER;
  }

  public BigDecimal feeOrZero() {
    return fee == null ? BigDecimal.ZERO : fee;
  }

  public String effectiveFeeAsset() {
    return feeAsset == null || feeAsset.isBlank() ? asset : feeAsset;
  }
}
