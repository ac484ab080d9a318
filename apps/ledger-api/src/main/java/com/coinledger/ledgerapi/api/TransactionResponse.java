package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.TransactionRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record TransactionResponse(
    Long id,
    String type,
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

  public static TransactionResponse from(TransactionRecord record) {
    return new TransactionResponse(
        record.id(),
        record.type().dbValue(),
        record.fromAccountId(),
        record.fromAsset(),
        record.fromQuantity(),
        record.toAccountId(),
        record.toAsset(),
        record.toQuantity(),
        record.unitPrice(),
        record.priceCurrency(),
        record.fee(),
        record.feeAsset(),
        record.exchangeRate(),
        record.exchangeRatePair(),
        record.externalId(),
        record.notes(),
        record.timestamp(),
        record.createdAt());
  }
}
