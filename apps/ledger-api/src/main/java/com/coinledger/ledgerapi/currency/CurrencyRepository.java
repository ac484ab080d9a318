package com.coinledger.ledgerapi.currency;

import com.coinledger.domain.ledger.Currency;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CurrencyRepository {
  boolean exists(String code);

  Optional<Currency> findByCode(String code);

  List<Currency> findAll();

  /** Inserts the currency; returns {@code false} when the code is already taken. */
  boolean insert(Currency currency);

  /** Returns {@code false} when no currency has the code. */
  boolean updateEnabled(String code, boolean enabled, Instant updatedAt);
}
