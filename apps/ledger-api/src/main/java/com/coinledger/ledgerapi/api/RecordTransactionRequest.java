package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.BuyCommand;
import com.coinledger.domain.ledger.SellCommand;
import com.coinledger.domain.ledger.SwapCommand;
import com.coinledger.domain.ledger.TransactionCommand;
import com.coinledger.domain.ledger.TransactionType;
import com.coinledger.domain.ledger.TransferCommand;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * One request shape for every transaction type. Buy and Sell use {@code account}, {@code asset},
 * {@code quantity} and {@code unitPrice}; Transfer uses {@code fromAccount}, {@code toAccount},
 * {@code asset}, {@code quantity} and the fee fields; Swap uses the from/to asset and quantity
 * fields, with {@code account} accepted in place of {@code fromAccount}.
 */
public record RecordTransactionRequest(
    @NotBlank String type,
    String account,
    String fromAccount,
    String toAccount,
    String asset,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal fee,
    String feeAsset,
    String fromAsset,
    BigDecimal fromQuantity,
    String toAsset,
    BigDecimal toQuantity,
    BigDecimal manualRate,
    Instant timestamp,
    String notes,
    String externalId) {

  public TransactionCommand toCommand() {
    TransactionType transactionType = TransactionType.parse(type);
    return switch (transactionType) {
      case BUY -> new BuyCommand(
          account, asset, quantity, unitPrice, timestamp, notes, externalId);
      case SELL -> new SellCommand(
          account, asset, quantity, unitPrice, timestamp, notes, externalId);
      case TRANSFER -> new TransferCommand(
          fromAccount, toAccount, asset, quantity, fee, feeAsset, timestamp, notes, externalId);
      case SWAP -> new SwapCommand(
          fromAccount != null ? fromAccount : account,
          toAccount,
          fromAsset,
          fromQuantity,
          toAsset,
          toQuantity,
          manualRate,
          timestamp,
          notes,
          externalId);
    };
  }
}
