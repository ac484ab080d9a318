package com.coinledger.domain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class TransactionTypeTest {
  @Test
  void shouldParseImportAliases() {
    assertEquals(TransactionType.SWAP, TransactionType.parse("trade"));
    assertEquals(TransactionType.TRANSFER, TransactionType.parse("TRANSFER_INTERNAL"));
    assertEquals(TransactionType.BUY, TransactionType.parse(" buy "));
  }

  @Test
  void shouldRejectUnsupportedTypes() {
    assertThrows(InvalidInputException.class, () -> TransactionType.parse("airdrop"));
  }

  @Test
  void shouldDefaultSwapTargetAccountAndTransferFeeAsset() {
    SwapCommand swap =
        new SwapCommand("Binance", "USDT", BigDecimal.TEN, "BTC", new BigDecimal("0.0001"));
    TransferCommand transfer =
        new TransferCommand("Binance", "Ledger", "BTC", new BigDecimal("0.5"));

    assertEquals("Binance", swap.targetAccount());
    assertEquals("BTC", transfer.effectiveFeeAsset());
    assertEquals(0, BigDecimal.ZERO.compareTo(transfer.feeOrZero()));
  }
}
