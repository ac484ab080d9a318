package com.coinledger.ledgerapi.transactions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.coinledger.domain.ledger.AccountNotFoundException;
import com.coinledger.domain.ledger.AlreadyExistsException;
import com.coinledger.domain.ledger.BuyCommand;
import com.coinledger.domain.ledger.CostBasisCalculator;
import com.coinledger.domain.ledger.ExchangeRate;
import com.coinledger.domain.ledger.Holding;
import com.coinledger.domain.ledger.InsufficientHoldingsException;
import com.coinledger.domain.ledger.InvalidInputException;
import com.coinledger.domain.ledger.LedgerArithmeticException;
import com.coinledger.domain.ledger.LedgerConflictException;
import com.coinledger.domain.ledger.LedgerErrorCode;
import com.coinledger.domain.ledger.NotFoundException;
import com.coinledger.domain.ledger.RateUnavailableException;
import com.coinledger.domain.ledger.SellCommand;
import com.coinledger.domain.ledger.SwapCommand;
import com.coinledger.domain.ledger.TransactionRecord;
import com.coinledger.domain.ledger.TransactionType;
import com.coinledger.domain.ledger.TransferCommand;
import com.coinledger.ledgerapi.accounts.AccountView;
import com.coinledger.ledgerapi.support.LedgerTestContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;

class TransactionRecorderTest {
  private LedgerTestContext ctx;
  private TransactionRecorder recorder;
  private AccountView binance;
  private AccountView ledgerNano;
  private AccountView bank;

  @BeforeEach
  void setUp() {
    ctx = new LedgerTestContext();
    recorder = ctx.transactionRecorder;
    binance = ctx.ledger.addAccount("Binance", "Trading");
    ledgerNano = ctx.ledger.addAccount("Ledger Nano", "Cold Storage");
    bank = ctx.ledger.addAccount("BAC San Jose", "Banking");
  }

  @Test
  void shouldWeightAverageCostAcrossBuys() {
    buy(binance, "BTC", "0.1", "50000");

    RecordedTransaction recorded = buy(binance, "BTC", "0.1", "60000");

    Holding btc = holding(binance, "BTC");
    assertDecimal("0.2", btc.quantity());
    assertDecimal("55000", btc.avgCostBasis());
    assertEquals(TransactionType.BUY, recorded.transaction().type());
    assertEquals(binance.id(), recorded.transaction().toAccountId());
    assertEquals("USD", recorded.transaction().priceCurrency());
    assertNull(recorded.realizedGain());
  }

  @Test
  void shouldResolveAccountsByNameCaseInsensitively() {
    recorder.record(new BuyCommand("binance", "btc", new BigDecimal("1"), new BigDecimal("100")));

    assertDecimal("1", holding(binance, "BTC").quantity());
  }

  @Test
  void shouldStampMissingTimestampWithClock() {
    RecordedTransaction recorded = buy(binance, "ETH", "1", "2000");

    assertEquals(LedgerTestContext.NOW, recorded.transaction().timestamp());
  }

  @Test
  void shouldKeepAverageOnSellAndReportAdvisoryGain() {
    buy(binance, "BTC", "0.2", "55000");

    RecordedTransaction recorded =
        recorder.record(
            new SellCommand("Binance", "BTC", new BigDecimal("0.05"), new BigDecimal("70000")));

    Holding btc = holding(binance, "BTC");
    assertDecimal("0.15", btc.quantity());
    assertDecimal("55000", btc.avgCostBasis());
    assertDecimal("750", recorded.realizedGain());
    assertEquals(binance.id(), recorded.transaction().fromAccountId());
  }

  @Test
  void shouldRejectOversellAndLeaveHoldingUnchanged() {
    buy(binance, "BTC", "0.2", "50000");
    int transactionsBefore = ctx.ledger.transactions().size();

    InsufficientHoldingsException ex =
        assertThrows(
            InsufficientHoldingsException.class,
            () ->
                recorder.record(
                    new SellCommand(
                        "Binance", "BTC", new BigDecimal("0.3"), new BigDecimal("60000"))));

    assertEquals(LedgerErrorCode.INSUFFICIENT_HOLDINGS, ex.code());
    assertDecimal("0.2", ex.available());
    assertDecimal("0.2", holding(binance, "BTC").quantity());
    assertEquals(transactionsBefore, ctx.ledger.transactions().size());
    assertEquals(
        1.0,
        ctx.meterRegistry
            .counter(
                "ledger.transactions.recorded.total", "type", "sell", "outcome", "rejected")
            .count());
  }

  @Test
  void shouldTransferNetOfFeeCarryingSourceCost() {
    buy(binance, "BTC", "0.5", "40000");

    RecordedTransaction recorded =
        recorder.record(
            new TransferCommand(
                "Binance",
                "Ledger Nano",
                "BTC",
                new BigDecimal("0.2"),
                new BigDecimal("0.001"),
                null,
                null,
                "cold storage",
                null));

    Holding source = holding(binance, "BTC");
    Holding destination = holding(ledgerNano, "BTC");
    assertDecimal("0.3", source.quantity());
    assertDecimal("40000", source.avgCostBasis());
    assertDecimal("0.199", destination.quantity());
    assertDecimal("40000", destination.avgCostBasis());
    assertDecimal("-40", recorded.realizedGain());

    TransactionRecord tx = recorded.transaction();
    assertDecimal("0.2", tx.fromQuantity());
    assertDecimal("0.199", tx.toQuantity());
    assertDecimal("0.001", tx.fee());
    assertEquals("BTC", tx.feeAsset());
  }

  @Test
  void shouldConserveQuantityAcrossTransferWithoutFee() {
    buy(binance, "ETH", "3", "1800");
    buy(ledgerNano, "ETH", "1", "2400");

    recorder.record(new TransferCommand("Binance", "Ledger Nano", "ETH", new BigDecimal("2")));

    assertDecimal("1", holding(binance, "ETH").quantity());
    Holding destination = holding(ledgerNano, "ETH");
    assertDecimal("3", destination.quantity());
    assertDecimal("2000", destination.avgCostBasis());
  }

  @Test
  void shouldConvertFeeInAnotherAssetThroughInverseRate() {
    buy(binance, "BTC", "0.5", "40000");
    Instant anHourAgo = LedgerTestContext.NOW.minusSeconds(3600);
    ctx.exchangeRateStore.upsert(
        ExchangeRate.manual("BTC", "USDT", new BigDecimal("50000"), anHourAgo, null));

    recorder.record(
        new TransferCommand(
            "Binance",
            "Ledger Nano",
            "BTC",
            new BigDecimal("0.2"),
            new BigDecimal("5"),
            "USDT",
            null,
            null,
            null));

    assertDecimal("0.1999", holding(ledgerNano, "BTC").quantity());
    assertDecimal("0.3", holding(binance, "BTC").quantity());
  }

  @Test
  void shouldFailFeeConversionWithoutUsableRate() {
    buy(binance, "BTC", "0.5", "40000");
    TransferCommand transfer =
        new TransferCommand(
            "Binance",
            "Ledger Nano",
            "BTC",
            new BigDecimal("0.2"),
            new BigDecimal("5"),
            "USDT",
            null,
            null,
            null);

    assertThrows(RateUnavailableException.class, () -> recorder.record(transfer));

    ctx.exchangeRateStore.upsert(
        ExchangeRate.manual(
            "USDT",
            "BTC",
            new BigDecimal("0.00002"),
            LedgerTestContext.NOW.minus(Duration.ofDays(31)),
            null));

    RateUnavailableException stale =
        assertThrows(RateUnavailableException.class, () -> recorder.record(transfer));
    assertEquals(LedgerErrorCode.RATE_UNAVAILABLE, stale.code());
    assertDecimal("0.5", holding(binance, "BTC").quantity());
  }

  @Test
  void shouldRejectTransferToSameAccountOrFeeConsumingQuantity() {
    buy(binance, "BTC", "0.5", "40000");

    assertThrows(
        InvalidInputException.class,
        () -> recorder.record(new TransferCommand("Binance", "binance", "BTC", BigDecimal.ONE)));
    assertThrows(
        InvalidInputException.class,
        () ->
            recorder.record(
                new TransferCommand(
                    "Binance",
                    "Ledger Nano",
                    "BTC",
                    new BigDecimal("0.1"),
                    new BigDecimal("0.1"),
                    null,
                    null,
                    null,
                    null)));
  }

  @Test
  void shouldStoreImpliedRateForFiatSwap() {
    buy(bank, "CRC", "100000", "0.0018182");

    RecordedTransaction recorded =
        recorder.record(
            new SwapCommand(
                "BAC San Jose", "CRC", new BigDecimal("100000"), "USD", new BigDecimal("181.82")));

    List<ExchangeRate> rates = ctx.ledger.rates();
    assertEquals(1, rates.size());
    ExchangeRate stored = rates.get(0);
    assertEquals("CRC/USD", stored.pair());
    assertDecimal("0.0018182", stored.rate());
    assertEquals(ExchangeRate.SOURCE_SWAP, stored.source());
    assertEquals(LedgerTestContext.NOW, stored.timestamp());

    assertDecimal("0", holding(bank, "CRC").quantity());
    Holding usd = holding(bank, "USD");
    assertDecimal("181.82", usd.quantity());
    assertDecimal("1", usd.avgCostBasis());
    assertDecimal("0.0018182", recorded.transaction().exchangeRate());
    assertEquals("CRC/USD", recorded.transaction().exchangeRatePair());
    assertNotNull(recorded.capturedRate());
  }

  @Test
  void shouldPreferManualRateForFiatSwap() {
    buy(bank, "USD", "1000", "1");

    recorder.record(
        new SwapCommand(
            "BAC San Jose",
            null,
            "USD",
            new BigDecimal("100"),
            "CRC",
            new BigDecimal("54000"),
            new BigDecimal("550"),
            null,
            null,
            null));

    ExchangeRate stored = ctx.ledger.rates().get(0);
    assertEquals("USD/CRC", stored.pair());
    assertDecimal("550", stored.rate());
    Holding crc = holding(bank, "CRC");
    assertDecimal("54000", crc.quantity());
    BigDecimal expectedCost =
        BigDecimal.ONE.divide(new BigDecimal("550"), CostBasisCalculator.MATH_CONTEXT);
    assertEquals(0, expectedCost.compareTo(crc.avgCostBasis()));
  }

  @Test
  void shouldCarryCostIntoCryptoSwapWithoutStoringRate() {
    buy(binance, "USDT", "1000", "1");

    RecordedTransaction recorded =
        recorder.record(
            new SwapCommand(
                "Binance", "USDT", new BigDecimal("500"), "BTC", new BigDecimal("0.01")));

    assertTrue(ctx.ledger.rates().isEmpty());
    assertDecimal("500", holding(binance, "USDT").quantity());
    Holding btc = holding(binance, "BTC");
    assertDecimal("0.01", btc.quantity());
    assertDecimal("50000", btc.avgCostBasis());
    assertDecimal("50000", recorded.transaction().unitPrice());
    assertNull(recorded.realizedGain());
  }

  @Test
  void shouldSwapAcrossAccounts() {
    buy(binance, "USDT", "1000", "1");

    recorder.record(
        new SwapCommand(
            "Binance",
            "Ledger Nano",
            "USDT",
            new BigDecimal("500"),
            "BTC",
            new BigDecimal("0.01"),
            null,
            null,
            null,
            null));

    assertDecimal("0.01", holding(ledgerNano, "BTC").quantity());
    assertTrue(ctx.holdingsLedger.find(binance.id(), "BTC").isEmpty());
  }

  @Test
  void shouldSwapSameAssetAcrossAccountsCarryingCost() {
    buy(binance, "USDT", "1000", "1");

    RecordedTransaction recorded =
        recorder.record(
            new SwapCommand(
                "Binance",
                "Ledger Nano",
                "USDT",
                new BigDecimal("100"),
                "USDT",
                new BigDecimal("99.5"),
                null,
                null,
                null,
                null));

    assertDecimal("900", holding(binance, "USDT").quantity());
    Holding moved = holding(ledgerNano, "USDT");
    assertDecimal("99.5", moved.quantity());
    BigDecimal movedCost = moved.quantity().multiply(moved.avgCostBasis());
    assertDecimal("100.0000", movedCost.setScale(4, RoundingMode.HALF_UP));
    assertDecimal("0.995", recorded.transaction().exchangeRate());
    assertNull(recorded.transaction().exchangeRatePair());
    assertNull(recorded.capturedRate());
    assertTrue(ctx.ledger.rates().isEmpty());
  }

  @Test
  void shouldFailSwapWithZeroLegAsArithmeticError() {
    buy(bank, "CRC", "100000", "0.0018");

    LedgerArithmeticException ex =
        assertThrows(
            LedgerArithmeticException.class,
            () ->
                recorder.record(
                    new SwapCommand(
                        "BAC San Jose", "CRC", new BigDecimal("100000"), "USD", BigDecimal.ZERO)));

    assertEquals(LedgerErrorCode.ARITHMETIC_ERROR, ex.code());
    assertDecimal("100000", holding(bank, "CRC").quantity());
    assertTrue(ctx.ledger.rates().isEmpty());
  }

  @Test
  void shouldRejectSwapOfSameAssetWithinOneAccount() {
    buy(binance, "BTC", "1", "100");

    assertThrows(
        InvalidInputException.class,
        () ->
            recorder.record(
                new SwapCommand("Binance", "BTC", BigDecimal.ONE, "btc", BigDecimal.ONE)));
    assertThrows(
        InvalidInputException.class,
        () ->
            recorder.record(
                new SwapCommand(
                    "Binance",
                    "binance",
                    "BTC",
                    BigDecimal.ONE,
                    "BTC",
                    BigDecimal.ONE,
                    null,
                    null,
                    null,
                    null)));
    assertDecimal("1", holding(binance, "BTC").quantity());
  }

  @Test
  void shouldListKnownAccountsWhenAccountIsUnknown() {
    AccountNotFoundException ex =
        assertThrows(
            AccountNotFoundException.class,
            () ->
                recorder.record(
                    new BuyCommand("Kraken", "BTC", BigDecimal.ONE, new BigDecimal("100"))));

    assertEquals(LedgerErrorCode.NOT_FOUND, ex.code());
    assertEquals(List.of("BAC San Jose", "Binance", "Ledger Nano"), ex.knownAccounts());
  }

  @Test
  void shouldRejectUnknownAssetAndNonPositiveAmounts() {
    assertThrows(
        NotFoundException.class,
        () ->
            recorder.record(
                new BuyCommand("Binance", "DOGE", BigDecimal.ONE, new BigDecimal("0.1"))));
    assertThrows(
        InvalidInputException.class,
        () ->
            recorder.record(
                new BuyCommand("Binance", "BTC", BigDecimal.ZERO, new BigDecimal("100"))));
    assertThrows(
        InvalidInputException.class,
        () -> recorder.record(new BuyCommand("Binance", "BTC", BigDecimal.ONE, null)));
    assertTrue(ctx.ledger.transactions().isEmpty());
  }

  @Test
  void shouldAcceptDisabledCurrencyInTransactions() {
    ctx.currencyCatalog.setEnabled("SOL", false);

    buy(binance, "SOL", "10", "150");

    assertDecimal("10", holding(binance, "SOL").quantity());
  }

  @Test
  void shouldRejectDuplicateExternalId() {
    recorder.record(
        new BuyCommand(
            "Binance", "BTC", BigDecimal.ONE, new BigDecimal("100"), null, null, "import-1"));

    AlreadyExistsException ex =
        assertThrows(
            AlreadyExistsException.class,
            () ->
                recorder.record(
                    new BuyCommand(
                        "Binance",
                        "BTC",
                        BigDecimal.ONE,
                        new BigDecimal("100"),
                        null,
                        null,
                        "import-1")));

    assertEquals(LedgerErrorCode.ALREADY_EXISTS, ex.code());
    assertDecimal("1", holding(binance, "BTC").quantity());
  }

  @Test
  void shouldPreviewWithoutPersistingAnything() {
    buy(bank, "CRC", "100000", "0.0018182");
    int transactionsBefore = ctx.ledger.transactions().size();

    RecordedTransaction preview =
        recorder.preview(
            new SwapCommand(
                "BAC San Jose", "CRC", new BigDecimal("100000"), "USD", new BigDecimal("181.82")));

    assertTrue(preview.dryRun());
    assertEquals(2, preview.holdings().size());
    assertDecimal("181.82", preview.holdings().get(1).holding().quantity());
    assertDecimal("100000", holding(bank, "CRC").quantity());
    assertTrue(ctx.holdingsLedger.find(bank.id(), "USD").isEmpty());
    assertTrue(ctx.ledger.rates().isEmpty());
    assertEquals(transactionsBefore, ctx.ledger.transactions().size());
    assertEquals(
        1.0,
        ctx.meterRegistry
            .counter("ledger.transactions.recorded.total", "type", "swap", "outcome", "preview")
            .count());
  }

  @Test
  void shouldPreviewValidationFailuresLikeRecord() {
    assertThrows(
        InsufficientHoldingsException.class,
        () ->
            recorder.preview(
                new SellCommand("Binance", "BTC", BigDecimal.ONE, new BigDecimal("100"))));
  }

  @Test
  void shouldTranslateLockFailureToConflictAndRollBack() {
    TransactionRepository failingRepository = mock(TransactionRepository.class);
    when(failingRepository.insert(any()))
        .thenThrow(new CannotAcquireLockException("could not serialize access"));
    TransactionRecorder conflicted =
        new TransactionRecorder(
            ctx.accountRegistry,
            ctx.currencyCatalog,
            ctx.holdingsLedger,
            ctx.exchangeRateStore,
            failingRepository,
            ctx.properties,
            ctx.clock,
            ctx.meterRegistry,
            ctx.transactionManager);

    LedgerConflictException ex =
        assertThrows(
            LedgerConflictException.class,
            () ->
                conflicted.record(
                    new BuyCommand("Binance", "BTC", BigDecimal.ONE, new BigDecimal("100"))));

    assertEquals(LedgerErrorCode.CONFLICT, ex.code());
    assertTrue(ctx.holdingsLedger.find(binance.id(), "BTC").isEmpty());
    assertEquals(1, ctx.transactionManager.rolledBack());
    assertEquals(
        1.0,
        ctx.meterRegistry
            .counter("ledger.transactions.recorded.total", "type", "buy", "outcome", "conflict")
            .count());
  }

  @Test
  void shouldListNewestFirstWithLimits() {
    recorder.record(
        new BuyCommand(
            "Binance",
            "BTC",
            BigDecimal.ONE,
            new BigDecimal("100"),
            Instant.parse("2026-01-10T00:00:00Z"),
            null,
            null));
    recorder.record(
        new BuyCommand(
            "Ledger Nano",
            "ETH",
            BigDecimal.ONE,
            new BigDecimal("100"),
            Instant.parse("2026-01-12T00:00:00Z"),
            null,
            null));
    recorder.record(
        new BuyCommand(
            "Binance",
            "ETH",
            BigDecimal.ONE,
            new BigDecimal("100"),
            Instant.parse("2026-01-11T00:00:00Z"),
            null,
            null));

    List<TransactionRecord> recent = recorder.list(2);
    List<TransactionRecord> forBinance = recorder.listByAccount("binance", null);

    assertEquals(2, recent.size());
    assertEquals("ETH", recent.get(0).toAsset());
    assertEquals(ledgerNano.id(), recent.get(0).toAccountId());
    assertEquals(2, forBinance.size());
    assertEquals(Instant.parse("2026-01-11T00:00:00Z"), forBinance.get(0).timestamp());
    assertFalse(forBinance.stream().anyMatch(tx -> ledgerNano.id().equals(tx.toAccountId())));
  }

  private RecordedTransaction buy(
      AccountView account, String asset, String quantity, String price) {
    return recorder.record(
        new BuyCommand(account.name(), asset, new BigDecimal(quantity), new BigDecimal(price)));
  }

  private Holding holding(AccountView account, String asset) {
    return ctx.holdingsLedger
        .find(account.id(), asset)
        .orElseThrow(() -> new AssertionError("no " + asset + " holding for " + account.name()));
  }

  private static void assertDecimal(String expected, BigDecimal actual) {
    assertNotNull(actual);
    assertEquals(
        0,
        new BigDecimal(expected).compareTo(actual),
        () -> "expected " + expected + " but was " + actual.toPlainString());
  }
}
