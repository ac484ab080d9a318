package com.coinledger.domain.ledger;

import java.util.Locale;

public enum AssetClass {
  FIAT("fiat", "Fiat", 1),
  STABLECOIN("stablecoin", "Stablecoin", 2),
  CRYPTO("crypto", "Cryptocurrency", 3);

  private final String dbValue;
  private final String displayName;
  private final int listingOrder;

  AssetClass(String dbValue, String displayName, int listingOrder) {
    this.dbValue = dbValue;
    this.displayName = displayName;
    this.listingOrder = listingOrder;
  }

  public String dbValue() {
    return dbValue;
  }

  public String displayName() {
    return displayName;
  }

  public int listingOrder() {
    return listingOrder;
  }

  public static AssetClass parse(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidInputException("asset class must not be blank");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "fiat" -> FIAT;
      case "crypto", "cryptocurrency" -> CRYPTO;
      case "stablecoin", "stable" -> STABLECOIN;
      default -> throw new InvalidInputException("Unsupported asset class: " + value);
    };
  }
}
