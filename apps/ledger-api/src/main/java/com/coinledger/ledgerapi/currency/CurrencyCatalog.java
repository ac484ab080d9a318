package com.coinledger.ledgerapi.currency;

import com.coinledger.domain.ledger.AlreadyExistsException;
import com.coinledger.domain.ledger.AssetClass;
import com.coinledger.domain.ledger.Currency;
import com.coinledger.domain.ledger.NotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Registry of the currencies the ledger accepts. Currencies are disabled, never deleted. */
@Service
public class CurrencyCatalog {
  private static final Logger log = LoggerFactory.getLogger(CurrencyCatalog.class);
  private static final Comparator<Currency> LISTING_ORDER =
      Comparator.comparingInt((Currency currency) -> currency.assetClass().listingOrder())
          .thenComparing(Currency::code);

  private final CurrencyRepository currencyRepository;
  private final Clock clock;

  public CurrencyCatalog(CurrencyRepository currencyRepository, Clock clock) {
    this.currencyRepository = currencyRepository;
    this.clock = clock;
  }

  @Transactional
  public Currency register(
      String code, String name, String symbol, int decimals, AssetClass assetClass) {
    Currency currency = Currency.create(code, name, symbol, decimals, assetClass, clock.instant());
    if (!currencyRepository.insert(currency)) {
      throw new AlreadyExistsException("Currency", currency.code());
    }
    log.info(
        "Registered currency code={} assetClass={} decimals={}",
        currency.code(),
        assetClass.dbValue(),
        decimals);
    return currency;
  }

  @Transactional(readOnly = true)
  public Currency get(String code) {
    String normalized = Currency.normalizeCode(code);
    return currencyRepository
        .findByCode(normalized)
        .orElseThrow(() -> new NotFoundException("Currency", normalized));
  }

  @Transactional(readOnly = true)
  public boolean exists(String code) {
    return currencyRepository.exists(Currency.normalizeCode(code));
  }

  /**
   * Lists currencies fiat first, then stablecoins, then other crypto, each group by code.
   *
   * @param assetClass optional filter; {@code null} lists every class
   */
  @Transactional(readOnly = true)
  public List<Currency> list(AssetClass assetClass, boolean enabledOnly) {
    return currencyRepository.findAll().stream()
        .filter(currency -> assetClass == null || currency.assetClass() == assetClass)
        .filter(currency -> !enabledOnly || currency.enabled())
        .sorted(LISTING_ORDER)
        .toList();
  }

  @Transactional
  public Currency setEnabled(String code, boolean enabled) {
    Currency current = get(code);
    if (current.enabled() == enabled) {
      return current;
    }
    Instant now = clock.instant();
    if (!currencyRepository.updateEnabled(current.code(), enabled, now)) {
      throw new NotFoundException("Currency", current.code());
    }
    log.info("Currency {} enabled={}", current.code(), enabled);
    return current.withEnabled(enabled, now);
  }
}
