package com.coinledger.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** An appended ledger event. Leg columns that do not apply to the type are {@code null}. */
public record TransactionRecord(
    Long id,
    TransactionType type,
    UUID fromAccountId,
    String fromAsset,
    BigDecimal fromQuantity,
    UUID toAccountId,
    String toAsset,
    BigDecimal toQuantity,
    BigDecimal unitPrice,
    String priceCurrency,
    BigDecimal fee,
    String feeAsset,
    BigDecimal exchangeRate,
    String exchangeRatePair,
    String externalId,
    String notes,
    Instant timestamp,
    Instant createdAt) {

  public TransactionRecord withId(Long newId, Instant newCreatedAt) {
    return new TransactionRecord(
        newId,
        type,
        fromAccountId,
        fromAsset,
        fromQuantity,
        toAccountId,
        toAsset,
        toQuantity,
        unitPrice,
        priceCurrency,
        fee,
        feeAsset,
        exchangeRate,
        exchangeRatePair,
        externalId,
        notes,
        timestamp,
        newCreatedAt);
  }
}
