package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.ExchangeRate;
import java.math.BigDecimal;
import java.time.Instant;

public record ExchangeRateResponse(
    Long id,
    String from,
    String to,
    String pair,
    BigDecimal rate,
    BigDecimal inverseRate,
    Instant timestamp,
    String source,
    String notes) {

  public static ExchangeRateResponse from(ExchangeRate rate) {
    return new ExchangeRateResponse(
        rate.id(),
        rate.fromCurrency(),
        rate.toCurrency(),
        rate.pair(),
        rate.rate(),
        rate.inverse().rate(),
        rate.timestamp(),
        rate.source(),
        rate.notes());
  }
}
