package com.coinledger.domain.ledger;

import java.util.Locale;

public enum TransactionType {
  BUY("buy", "Buy"),
  SELL("sell", "Sell"),
  TRANSFER("transfer", "Internal Transfer"),
  SWAP("swap", "Swap");

  private final String dbValue;
  private final String displayName;

  TransactionType(String dbValue, String displayName) {
    this.dbValue = dbValue;
    this.displayName = displayName;
  }

  public String dbValue() {
    return dbValue;
  }

  public String displayName() {
    return displayName;
  }

  public static TransactionType parse(String value) {
    if (value == null) {
      throw new InvalidInputException("transaction type is required");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "buy" -> BUY;
      case "sell" -> SELL;
      case "transfer", "transfer_internal" -> TRANSFER;
      case "swap", "trade" -> SWAP;
      default -> throw new InvalidInputException("Unknown transaction type: " + value);
    };
  }
}
