package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A directional rate: {@code rate} units of {@code toCurrency} buy one unit of {@code
 * fromCurrency} at {@code timestamp}.
 *
 * <p>Timestamps are truncated to microseconds so a rate read back from the store compares equal
 * to the one written.
 */
public record ExchangeRate(
    Long id,
    String fromCurrency,
    String toCurrency,
    BigDecimal rate,
    Instant timestamp,
    String source,
    String notes,
    Instant createdAt) {
  public static final String SOURCE_MANUAL = "manual";
  public static final String SOURCE_SWAP = "swap";
  public static final String SOURCE_CALCULATED = "calculated";

  public ExchangeRate {
    fromCurrency = Currency.normalizeCode(fromCurrency);
    toCurrency = Currency.normalizeCode(toCurrency);
    if (fromCurrency.equals(toCurrency)) {
      throw new InvalidInputException("Exchange rate currencies must differ: " + fromCurrency);
    }
    if (rate == null || rate.signum() <= 0) {
      throw new InvalidInputException("rate must be > 0");
    }
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
    source = source == null || source.isBlank() ? SOURCE_MANUAL : source.trim();
  }

  public static ExchangeRate manual(
      String fromCurrency, String toCurrency, BigDecimal rate, Instant timestamp, String notes) {
    return new ExchangeRate(
        null, fromCurrency, toCurrency, rate, timestamp, SOURCE_MANUAL, notes, null);
  }

  /**
   * Rate implied by exchanging {@code fromQuantity} of one currency for {@code toQuantity} of
   * another, in this record's direction (to-units per from-unit).
   */
  public static BigDecimal impliedRate(BigDecimal fromQuantity, BigDecimal toQuantity) {
    if (fromQuantity == null || toQuantity == null) {
      throw new InvalidInputException("both swap quantities are required to imply a rate");
    }
    if (fromQuantity.signum() == 0 || toQuantity.signum() == 0) {
      throw new LedgerArithmeticException(
          "Cannot derive an exchange rate from a zero quantity leg");
    }
    return toQuantity.divide(fromQuantity, CostBasisCalculator.MATH_CONTEXT);
  }

  public String pair() {
    return fromCurrency + "/" + toCurrency;
  }

  public ExchangeRate inverse() {
    return new ExchangeRate(
        null,
        toCurrency,
        fromCurrency,
        BigDecimal.ONE.divide(rate, CostBasisCalculator.MATH_CONTEXT),
        timestamp,
        SOURCE_CALCULATED,
        "Inverse of " + pair(),
        null);
  }

  public BigDecimal convert(BigDecimal amount) {
    return amount.multiply(rate, CostBasisCalculator.MATH_CONTEXT);
  }
}
