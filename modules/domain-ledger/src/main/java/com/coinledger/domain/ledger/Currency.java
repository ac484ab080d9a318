package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public record Currency(
    String code,
    String name,
    String symbol,
    int decimals,
    AssetClass assetClass,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt) {
  private static final Pattern CODE_PATTERN = Pattern.compile("[A-Z0-9]{2,10}");

  public Currency {
    code = normalizeCode(code);
    if (name == null || name.isBlank()) {
      throw new InvalidInputException("name must not be blank");
    }
    if (symbol == null || symbol.isBlank()) {
      throw new InvalidInputException("symbol must not be blank");
    }
    if (decimals < 0) {
      throw new InvalidInputException("decimals must be >= 0");
    }
    Objects.requireNonNull(assetClass, "assetClass must not be null");
  }

  public static Currency create(
      String code, String name, String symbol, int decimals, AssetClass assetClass, Instant now) {
    return new Currency(code, name, symbol, decimals, assetClass, true, now, now);
  }

  public static String normalizeCode(String code) {
    if (code == null || code.isBlank()) {
      throw new InvalidInputException("currency code must not be blank");
    }
    String normalized = code.trim().toUpperCase(Locale.ROOT);
    if (!CODE_PATTERN.matcher(normalized).matches()) {
      throw new InvalidInputException("Malformed currency code: " + code);
    }
    return normalized;
  }

  public boolean isFiat() {
    return assetClass == AssetClass.FIAT;
  }

  public boolean isCrypto() {
    return assetClass == AssetClass.CRYPTO || assetClass == AssetClass.STABLECOIN;
  }

  public boolean isStablecoin() {
    return assetClass == AssetClass.STABLECOIN;
  }

  /** Display rounding only; stored and computed amounts keep full precision. */
  public BigDecimal roundForDisplay(BigDecimal amount) {
    return amount.setScale(decimals, RoundingMode.HALF_EVEN);
  }

  public Currency withEnabled(boolean nextEnabled, Instant now) {
    return new Currency(code, name, symbol, decimals, assetClass, nextEnabled, createdAt, now);
  }
}
