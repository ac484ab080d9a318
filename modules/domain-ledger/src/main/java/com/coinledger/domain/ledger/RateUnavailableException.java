package com.coinledger.domain.ledger;

import java.time.Instant;

public class RateUnavailableException extends LedgerDomainException {
  public RateUnavailableException(String fromCurrency, String toCurrency, Instant at) {
    super(
        LedgerErrorCode.RATE_UNAVAILABLE,
        "No usable exchange rate for " + fromCurrency + "/" + toCurrency + " as of " + at);
  }
}
