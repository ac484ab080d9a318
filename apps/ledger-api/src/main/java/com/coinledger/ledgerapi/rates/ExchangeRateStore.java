package com.coinledger.ledgerapi.rates;

import com.coinledger.domain.ledger.Currency;
import com.coinledger.domain.ledger.ExchangeRate;
import com.coinledger.domain.ledger.NotFoundException;
import com.coinledger.domain.ledger.RateUnavailableException;
import com.coinledger.ledgerapi.config.LedgerProperties;
import com.coinledger.ledgerapi.currency.CurrencyCatalog;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Directional, timestamped exchange rates. Only the direction that was written is stored; lookups
 * never invert except for {@link #convert}.
 */
@Service
public class ExchangeRateStore {
  private static final Logger log = LoggerFactory.getLogger(ExchangeRateStore.class);

  private final ExchangeRateRepository exchangeRateRepository;
  private final CurrencyCatalog currencyCatalog;
  private final LedgerProperties properties;

  public ExchangeRateStore(
      ExchangeRateRepository exchangeRateRepository,
      CurrencyCatalog currencyCatalog,
      LedgerProperties properties) {
    this.exchangeRateRepository = exchangeRateRepository;
    this.currencyCatalog = currencyCatalog;
    this.properties = properties;
  }

  @Transactional
  public long upsert(ExchangeRate rate) {
    ensureCurrencyExists(rate.fromCurrency());
    ensureCurrencyExists(rate.toCurrency());
    long id = exchangeRateRepository.upsert(rate);
    log.info(
        "Stored exchange rate id={} pair={} rate={} at={} source={}",
        id,
        rate.pair(),
        rate.rate().toPlainString(),
        rate.timestamp(),
        rate.source());
    return id;
  }

  @Transactional(readOnly = true)
  public ExchangeRate latest(String fromCurrency, String toCurrency) {
    String from = Currency.normalizeCode(fromCurrency);
    String to = Currency.normalizeCode(toCurrency);
    return exchangeRateRepository
        .findLatest(from, to)
        .orElseThrow(() -> new NotFoundException("Exchange rate", from + "/" + to));
  }

  @Transactional(readOnly = true)
  public ExchangeRate asOf(String fromCurrency, String toCurrency, Instant at) {
    String from = Currency.normalizeCode(fromCurrency);
    String to = Currency.normalizeCode(toCurrency);
    return exchangeRateRepository
        .findAsOf(from, to, at)
        .orElseThrow(
            () -> new NotFoundException("Exchange rate", from + "/" + to + " as of " + at));
  }

  public RateHistory history(String fromCurrency, String toCurrency) {
    return new RateHistory(
        exchangeRateRepository,
        Currency.normalizeCode(fromCurrency),
        Currency.normalizeCode(toCurrency),
        properties.getRates().getHistoryPageSize());
  }

  public BigDecimal convert(BigDecimal amount, String fromCurrency, String toCurrency, Instant at) {
    return convert(amount, fromCurrency, toCurrency, at, properties.getRates().getMaxAge());
  }

  /**
   * Converts {@code amount} using the direct rate in force at {@code at}, falling back to the
   * inverse of the opposite direction. Rates older than {@code maxAge} are ignored.
   */
  @Transactional(readOnly = true)
  public BigDecimal convert(
      BigDecimal amount, String fromCurrency, String toCurrency, Instant at, Duration maxAge) {
    String from = Currency.normalizeCode(fromCurrency);
    String to = Currency.normalizeCode(toCurrency);
    if (from.equals(to)) {
      return amount;
    }
    Optional<ExchangeRate> direct =
        exchangeRateRepository.findAsOf(from, to, at).filter(rate -> isFresh(rate, at, maxAge));
    if (direct.isPresent()) {
      return direct.get().convert(amount);
    }
    return exchangeRateRepository
        .findAsOf(to, from, at)
        .filter(rate -> isFresh(rate, at, maxAge))
        .map(ExchangeRate::inverse)
        .map(rate -> rate.convert(amount))
        .orElseThrow(() -> new RateUnavailableException(from, to, at));
  }

  private static boolean isFresh(ExchangeRate rate, Instant at, Duration maxAge) {
    return maxAge == null || !rate.timestamp().isBefore(at.minus(maxAge));
  }

  private void ensureCurrencyExists(String code) {
    if (!currencyCatalog.exists(code)) {
      throw new NotFoundException("Currency", code);
    }
  }
}
