package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.Currency;
import java.time.Instant;

public record CurrencyResponse(
    String code,
    String name,
    String symbol,
    int decimals,
    String assetClass,
    String assetClassName,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt) {

  public static CurrencyResponse from(Currency currency) {
    return new CurrencyResponse(
        currency.code(),
        currency.name(),
        currency.symbol(),
        currency.decimals(),
        currency.assetClass().dbValue(),
        currency.assetClass().displayName(),
        currency.enabled(),
        currency.createdAt(),
        currency.updatedAt());
  }
}
