package com.coinledger.ledgerapi.rates;

import com.coinledger.domain.ledger.ExchangeRate;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ExchangeRateRepository {
  /** Inserts the rate or replaces rate, source and notes of the row at the same instant. */
  long upsert(ExchangeRate rate);

  Optional<ExchangeRate> findLatest(String fromCurrency, String toCurrency);

  Optional<ExchangeRate> findAsOf(String fromCurrency, String toCurrency, Instant at);

  /**
   * Newest-first page of rates strictly older than {@code before}; a {@code null} cursor starts at
   * the newest rate.
   */
  List<ExchangeRate> findPageBefore(
      String fromCurrency, String toCurrency, Instant before, int limit);
}
