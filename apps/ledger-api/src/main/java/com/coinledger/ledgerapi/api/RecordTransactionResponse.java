package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.HoldingSnapshot;
import com.coinledger.ledgerapi.transactions.RecordedTransaction;
import java.math.BigDecimal;
import java.util.List;

public record RecordTransactionResponse(
    TransactionResponse transaction,
    List<HoldingResponse> holdings,
    BigDecimal realizedGain,
    ExchangeRateResponse capturedRate,
    boolean dryRun) {

  public static RecordTransactionResponse from(RecordedTransaction recorded) {
    return new RecordTransactionResponse(
        TransactionResponse.from(recorded.transaction()),
        recorded.holdings().stream()
            .map(HoldingSnapshot::holding)
            .map(HoldingResponse::from)
            .toList(),
        recorded.realizedGain(),
        recorded.capturedRate() != null
            ? ExchangeRateResponse.from(recorded.capturedRate())
            : null,
        recorded.dryRun());
  }
}
