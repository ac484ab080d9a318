package com.coinledger.ledgerapi.holdings;

import com.coinledger.domain.ledger.CostBasisCalculator;
import com.coinledger.domain.ledger.Currency;
import com.coinledger.domain.ledger.Holding;
import com.coinledger.domain.ledger.HoldingSnapshot;
import com.coinledger.domain.ledger.InvalidInputException;
import com.coinledger.domain.ledger.NotFoundException;
import com.coinledger.ledgerapi.accounts.AccountRegistry;
import com.coinledger.ledgerapi.config.LedgerProperties;
import com.coinledger.ledgerapi.currency.CurrencyCatalog;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-(account, asset) quantities with a running weighted-average cost basis. Writes join the
 * caller's transaction.
 */
@Service
public class HoldingsLedger {
  private final HoldingRepository holdingRepository;
  private final CurrencyCatalog currencyCatalog;
  private final AccountRegistry accountRegistry;
  private final LedgerProperties properties;
  private final Clock clock;

  public HoldingsLedger(
      HoldingRepository holdingRepository,
      CurrencyCatalog currencyCatalog,
      AccountRegistry accountRegistry,
      LedgerProperties properties,
      Clock clock) {
    this.holdingRepository = holdingRepository;
    this.currencyCatalog = currencyCatalog;
    this.accountRegistry = accountRegistry;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Applies a signed quantity change. A priced increase re-weights the average cost; a decrease
   * keeps it and reports the advisory realized gain when priced.
   *
   * @param unitPrice price per unit in the cost-basis currency, or {@code null}
   * @throws NotFoundException when the asset is not a registered currency
   * @throws com.coinledger.domain.ledger.AccountNotFoundException when the account is unknown
   */
  @Transactional
  public HoldingSnapshot apply(
      UUID accountId, String asset, BigDecimal quantityDelta, BigDecimal unitPrice) {
    if (accountId == null) {
      throw new InvalidInputException("accountId must not be null");
    }
    String code = Currency.normalizeCode(asset);
    Optional<Holding> existing = holdingRepository.findForUpdate(accountId, code);
    if (existing.isEmpty()) {
      // an existing row already satisfies both foreign keys
      if (!currencyCatalog.exists(code)) {
        throw new NotFoundException("Currency", code);
      }
      accountRegistry.resolve(accountId.toString());
    }
    Holding current = existing.orElseGet(() -> emptyHolding(accountId, code));
    HoldingSnapshot snapshot =
        CostBasisCalculator.apply(current, quantityDelta, unitPrice, clock.instant());
    if (existing.isPresent()) {
      holdingRepository.update(snapshot.holding());
    } else {
      holdingRepository.insert(snapshot.holding());
    }
    return snapshot;
  }

  /** Locks the holding row, if any, and returns it; an absent row reads as an empty holding. */
  @Transactional
  public Holding lock(UUID accountId, String asset) {
    String code = Currency.normalizeCode(asset);
    return holdingRepository
        .findForUpdate(accountId, code)
        .orElseGet(() -> emptyHolding(accountId, code));
  }

  @Transactional(readOnly = true)
  public Optional<Holding> find(UUID accountId, String asset) {
    return holdingRepository.find(accountId, Currency.normalizeCode(asset));
  }

  @Transactional(readOnly = true)
  public List<Holding> listByAccount(UUID accountId) {
    return holdingRepository.findByAccount(accountId);
  }

  @Transactional(readOnly = true)
  public List<Holding> listAll() {
    return holdingRepository.findAll();
  }

  public String costBasisCurrency() {
    return Currency.normalizeCode(properties.getCostBasisCurrency());
  }

  private Holding emptyHolding(UUID accountId, String asset) {
    return Holding.empty(accountId, asset, costBasisCurrency());
  }
}
