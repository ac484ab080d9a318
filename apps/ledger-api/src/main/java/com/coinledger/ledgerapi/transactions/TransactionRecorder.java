package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.AlreadyExistsException;
import com.coinledger.domain.ledger.BuyCommand;
import com.coinledger.domain.ledger.CostBasisCalculator;
import com.coinledger.domain.ledger.Currency;
import com.coinledger.domain.ledger.ExchangeRate;
import com.coinledger.domain.ledger.Holding;
import com.coinledger.domain.ledger.HoldingSnapshot;
import com.coinledger.domain.ledger.InsufficientHoldingsException;
import com.coinledger.domain.ledger.InvalidInputException;
import com.coinledger.domain.ledger.LedgerConflictException;
import com.coinledger.domain.ledger.LedgerDomainException;
import com.coinledger.domain.ledger.NotFoundException;
import com.coinledger.domain.ledger.SellCommand;
import com.coinledger.domain.ledger.SwapCommand;
import com.coinledger.domain.ledger.TransactionCommand;
import com.coinledger.domain.ledger.TransactionRecord;
import com.coinledger.domain.ledger.TransactionType;
import com.coinledger.domain.ledger.TransferCommand;
import com.coinledger.ledgerapi.accounts.AccountRegistry;
import com.coinledger.ledgerapi.accounts.AccountView;
import com.coinledger.ledgerapi.config.LedgerProperties;
import com.coinledger.ledgerapi.currency.CurrencyCatalog;
import com.coinledger.ledgerapi.holdings.HoldingsLedger;
import com.coinledger.ledgerapi.rates.ExchangeRateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Validates and applies Buy, Sell, Transfer and Swap transactions. Each call runs in one
 * serializable transaction: every leg is validated before any holding changes, and a failure
 * anywhere leaves no trace.
 */
@Service
public class TransactionRecorder {
  private static final Logger log = LoggerFactory.getLogger(TransactionRecorder.class);

  private static final String RECORDED_TOTAL_METRIC = "ledger.transactions.recorded.total";
  private static final String OUTCOME_SUCCESS = "success";
  private static final String OUTCOME_PREVIEW = "preview";
  private static final String OUTCOME_REJECTED = "rejected";
  private static final String OUTCOME_CONFLICT = "conflict";

  private final AccountRegistry accountRegistry;
  private final CurrencyCatalog currencyCatalog;
  private final HoldingsLedger holdingsLedger;
  private final ExchangeRateStore exchangeRateStore;
  private final TransactionRepository transactionRepository;
  private final LedgerProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate writeTemplate;
  private final TransactionTemplate readTemplate;

  public TransactionRecorder(
      AccountRegistry accountRegistry,
      CurrencyCatalog currencyCatalog,
      HoldingsLedger holdingsLedger,
      ExchangeRateStore exchangeRateStore,
      TransactionRepository transactionRepository,
      LedgerProperties properties,
      Clock clock,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.accountRegistry = accountRegistry;
    this.currencyCatalog = currencyCatalog;
    this.holdingsLedger = holdingsLedger;
    this.exchangeRateStore = exchangeRateStore;
    this.transactionRepository = transactionRepository;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;

    this.writeTemplate = new TransactionTemplate(transactionManager);
    this.writeTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    this.readTemplate = new TransactionTemplate(transactionManager);
    this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    this.readTemplate.setReadOnly(true);
  }

  public RecordedTransaction record(TransactionCommand command) {
    return execute(command, false);
  }

  /** Runs the full pipeline and reports its outcome, then rolls every change back. */
  public RecordedTransaction preview(TransactionCommand command) {
    return execute(command, true);
  }

  public List<TransactionRecord> list(Integer limit) {
    int effectiveLimit = properties.getTransactions().clampLimit(limit);
    return readTemplate.execute(status -> transactionRepository.findRecent(effectiveLimit));
  }

  public List<TransactionRecord> listByAccount(String accountRef, Integer limit) {
    int effectiveLimit = properties.getTransactions().clampLimit(limit);
    return readTemplate.execute(
        status -> {
          AccountView account = accountRegistry.resolve(accountRef);
          return transactionRepository.findByAccount(account.id(), effectiveLimit);
        });
  }

  private RecordedTransaction execute(TransactionCommand command, boolean dryRun) {
    Objects.requireNonNull(command, "command must not be null");
    String type = command.type().dbValue();
    try {
      RecordedTransaction recorded =
          writeTemplate.execute(
              status -> {
                RecordedTransaction result = recordInTransaction(command, dryRun);
                if (dryRun) {
                  status.setRollbackOnly();
                }
                return result;
              });
      count(type, dryRun ? OUTCOME_PREVIEW : OUTCOME_SUCCESS);
      if (!dryRun) {
        TransactionRecord saved = recorded.transaction();
        log.info(
            "Recorded transaction id={} type={} at={} externalId={}",
            saved.id(),
            type,
            saved.timestamp(),
            saved.externalId());
      }
      return recorded;
    } catch (ConcurrencyFailureException | DuplicateKeyException ex) {
      count(type, OUTCOME_CONFLICT);
      log.warn("Transaction of type={} conflicted with a concurrent writer", type, ex);
      throw new LedgerConflictException(
          "Concurrent ledger update detected; retry the transaction", ex);
    } catch (LedgerDomainException ex) {
      count(type, OUTCOME_REJECTED);
      throw ex;
    }
  }

  private RecordedTransaction recordInTransaction(TransactionCommand command, boolean dryRun) {
    Instant at = timestampOf(command);
    String externalId = blankToNull(command.externalId());
    if (externalId != null && transactionRepository.existsByExternalId(externalId)) {
      throw new AlreadyExistsException("Transaction", externalId);
    }

    LedgerPlan plan =
        switch (command.type()) {
          case BUY -> planBuy((BuyCommand) command, at, externalId);
          case SELL -> planSell((SellCommand) command, at, externalId);
          case TRANSFER -> planTransfer((TransferCommand) command, at, externalId);
          case SWAP -> planSwap((SwapCommand) command, at, externalId);
        };

    List<HoldingSnapshot> snapshots = new ArrayList<>();
    for (HoldingDelta delta : plan.deltas()) {
      snapshots.add(
          holdingsLedger.apply(
              delta.accountId(), delta.asset(), delta.quantity(), delta.unitPrice()));
    }
    if (plan.rateToStore() != null) {
      exchangeRateStore.upsert(plan.rateToStore());
    }
    TransactionRecord saved = transactionRepository.insert(plan.draft());

    BigDecimal realizedGain = plan.realizedGain();
    if (realizedGain == null) {
      realizedGain =
          snapshots.stream()
              .map(HoldingSnapshot::realizedGain)
              .filter(Objects::nonNull)
              .findFirst()
              .orElse(null);
    }
    return new RecordedTransaction(
        saved, List.copyOf(snapshots), realizedGain, plan.capturedRate(), dryRun);
  }

  private LedgerPlan planBuy(BuyCommand command, Instant at, String externalId) {
    AccountView account = accountRegistry.resolve(command.account());
    String asset = requireCurrency(command.asset());
    BigDecimal quantity = requirePositive(command.quantity(), "quantity");
    BigDecimal unitPrice = requirePositive(command.unitPrice(), "unitPrice");

    TransactionRecord draft =
        new TransactionRecord(
            null,
            TransactionType.BUY,
            null,
            null,
            null,
            account.id(),
            asset,
            quantity,
            unitPrice,
            holdingsLedger.costBasisCurrency(),
            null,
            null,
            null,
            null,
            externalId,
            command.notes(),
            at,
            null);
    return new LedgerPlan(
        List.of(new HoldingDelta(account.id(), asset, quantity, unitPrice)),
        draft,
        null,
        null,
        null);
  }

  private LedgerPlan planSell(SellCommand command, Instant at, String externalId) {
    AccountView account = accountRegistry.resolve(command.account());
    String asset = requireCurrency(command.asset());
    BigDecimal quantity = requirePositive(command.quantity(), "quantity");
    BigDecimal unitPrice = requirePositive(command.unitPrice(), "unitPrice");
    requireAvailable(account, asset, quantity);

    TransactionRecord draft =
        new TransactionRecord(
            null,
            TransactionType.SELL,
            account.id(),
            asset,
            quantity,
            null,
            null,
            null,
            unitPrice,
            holdingsLedger.costBasisCurrency(),
            null,
            null,
            null,
            null,
            externalId,
            command.notes(),
            at,
            null);
    return new LedgerPlan(
        List.of(new HoldingDelta(account.id(), asset, quantity.negate(), unitPrice)),
        draft,
        null,
        null,
        null);
  }

  private LedgerPlan planTransfer(TransferCommand command, Instant at, String externalId) {
    AccountView from = accountRegistry.resolve(command.fromAccount());
    AccountView to = accountRegistry.resolve(command.toAccount());
    if (from.id().equals(to.id())) {
      throw new InvalidInputException("Transfer source and destination accounts must differ");
    }
    String asset = requireCurrency(command.asset());
    BigDecimal quantity = requirePositive(command.quantity(), "quantity");
    BigDecimal fee = command.feeOrZero();
    if (fee.signum() < 0) {
      throw new InvalidInputException("fee must be >= 0");
    }
    String feeAsset = requireCurrency(command.effectiveFeeAsset());
    BigDecimal feeInAsset =
        fee.signum() == 0 ? BigDecimal.ZERO : exchangeRateStore.convert(fee, feeAsset, asset, at);
    BigDecimal netQuantity = quantity.subtract(feeInAsset);
    if (netQuantity.signum() <= 0) {
      throw new InvalidInputException(
          "Transfer fee " + feeInAsset.toPlainString() + " " + asset + " consumes the quantity");
    }
    Holding source = requireAvailable(from, asset, quantity);
    BigDecimal sourceCost = source.avgCostBasis();

    TransactionRecord draft =
        new TransactionRecord(
            null,
            TransactionType.TRANSFER,
            from.id(),
            asset,
            quantity,
            to.id(),
            asset,
            netQuantity,
            null,
            null,
            fee.signum() == 0 ? null : fee,
            fee.signum() == 0 ? null : feeAsset,
            null,
            null,
            externalId,
            command.notes(),
            at,
            null);
    BigDecimal feeLoss =
        feeInAsset.signum() == 0 ? null : feeInAsset.multiply(sourceCost).negate();
    return new LedgerPlan(
        List.of(
            new HoldingDelta(from.id(), asset, quantity.negate(), null),
            new HoldingDelta(to.id(), asset, netQuantity, sourceCost)),
        draft,
        null,
        null,
        feeLoss);
  }

  private LedgerPlan planSwap(SwapCommand command, Instant at, String externalId) {
    AccountView from = accountRegistry.resolve(command.fromAccount());
    AccountView to = accountRegistry.resolve(command.targetAccount());
    String fromAsset = requireCurrency(command.fromAsset());
    String toAsset = requireCurrency(command.toAsset());
    boolean sameAsset = fromAsset.equals(toAsset);
    if (sameAsset && from.id().equals(to.id())) {
      throw new InvalidInputException(
          "Swap legs must differ in account or asset: " + fromAsset + " in " + from.name());
    }
    BigDecimal fromQuantity = requireNonNegative(command.fromQuantity(), "fromQuantity");
    BigDecimal toQuantity = requireNonNegative(command.toQuantity(), "toQuantity");
    BigDecimal impliedRate = ExchangeRate.impliedRate(fromQuantity, toQuantity);
    BigDecimal rate =
        command.manualRate() != null
            ? requirePositive(command.manualRate(), "manualRate")
            : impliedRate;
    Holding source = requireAvailable(from, fromAsset, fromQuantity);

    BigDecimal fromUnitCost =
        fromAsset.equals(holdingsLedger.costBasisCurrency())
            ? BigDecimal.ONE
            : source.avgCostBasis();
    BigDecimal toUnitPrice =
        fromUnitCost.signum() == 0
            ? null
            : fromUnitCost.divide(rate, CostBasisCalculator.MATH_CONTEXT);

    // a same-asset move between accounts has no currency pair to capture
    ExchangeRate captured =
        sameAsset
            ? null
            : new ExchangeRate(
                null,
                fromAsset,
                toAsset,
                rate,
                at,
                ExchangeRate.SOURCE_SWAP,
                command.notes(),
                null);
    boolean fiatToFiat =
        !sameAsset
            && currencyCatalog.get(fromAsset).isFiat()
            && currencyCatalog.get(toAsset).isFiat();

    TransactionRecord draft =
        new TransactionRecord(
            null,
            TransactionType.SWAP,
            from.id(),
            fromAsset,
            fromQuantity,
            to.id(),
            toAsset,
            toQuantity,
            toUnitPrice,
            toUnitPrice == null ? null : holdingsLedger.costBasisCurrency(),
            null,
            null,
            rate,
            captured == null ? null : captured.pair(),
            externalId,
            command.notes(),
            at,
            null);
    return new LedgerPlan(
        List.of(
            new HoldingDelta(from.id(), fromAsset, fromQuantity.negate(), null),
            new HoldingDelta(to.id(), toAsset, toQuantity, toUnitPrice)),
        draft,
        captured,
        fiatToFiat ? captured : null,
        null);
  }

  private Holding requireAvailable(AccountView account, String asset, BigDecimal quantity) {
    Holding holding = holdingsLedger.lock(account.id(), asset);
    if (holding.quantity().compareTo(quantity) < 0) {
      throw new InsufficientHoldingsException(account.id(), asset, quantity, holding.quantity());
    }
    return holding;
  }

  private String requireCurrency(String code) {
    String normalized = Currency.normalizeCode(code);
    if (!currencyCatalog.exists(normalized)) {
      throw new NotFoundException("Currency", normalized);
    }
    return normalized;
  }

  private Instant timestampOf(TransactionCommand command) {
    Instant at = command.timestamp() != null ? command.timestamp() : clock.instant();
    return at.truncatedTo(ChronoUnit.MICROS);
  }

  private void count(String type, String outcome) {
    meterRegistry.counter(RECORDED_TOTAL_METRIC, "type", type, "outcome", outcome).increment();
  }

  private static BigDecimal requirePositive(BigDecimal value, String field) {
    if (value == null || value.signum() <= 0) {
      throw new InvalidInputException(field + " must be > 0");
    }
    return value;
  }

  private static BigDecimal requireNonNegative(BigDecimal value, String field) {
    if (value == null || value.signum() < 0) {
      throw new InvalidInputException(field + " must be >= 0");
    }
    return value;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private record HoldingDelta(
      UUID accountId, String asset, BigDecimal quantity, BigDecimal unitPrice) {}

  /**
   * Validated effects of one command.
   *
   * @param rateToStore rate written to the store on commit; only fiat-to-fiat swaps set it
   * @param realizedGain advisory gain known at planning time, or {@code null} to take it from the
   *     applied holdings
   */
  private record LedgerPlan(
      List<HoldingDelta> deltas,
      TransactionRecord draft,
      ExchangeRate capturedRate,
      ExchangeRate rateToStore,
      BigDecimal realizedGain) {}
}
