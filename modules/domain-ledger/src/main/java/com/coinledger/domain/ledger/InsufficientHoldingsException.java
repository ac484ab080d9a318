package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.util.UUID;

public class InsufficientHoldingsException extends LedgerDomainException {
  private final UUID accountId;
  private final String asset;
  private final BigDecimal requested;
  private final BigDecimal available;

  public InsufficientHoldingsException(
      UUID accountId, String asset, BigDecimal requested, BigDecimal available) {
    super(
        LedgerErrorCode.INSUFFICIENT_HOLDINGS,
        String.format(
            "Insufficient %s holdings for account %s: requested=%s, available=%s",
            asset, accountId, requested.toPlainString(), available.toPlainString()));
    this.accountId = accountId;
    this.asset = asset;
    this.requested = requested;
    this.available = available;
  }

  public UUID accountId() {
    return accountId;
  }

  public String asset() {
    return asset;
  }

  public BigDecimal requested() {
    return requested;
  }

  public BigDecimal available() {
    return available;
  }
}
