package com.coinledger.ledgerapi.portfolio;

import com.coinledger.domain.ledger.Currency;
import com.coinledger.domain.ledger.InvalidInputException;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Current price per unit of an asset, in the cost-basis currency. Supplied by the caller. */
@FunctionalInterface
public interface PriceLookup {
  Optional<BigDecimal> priceOf(String asset);

  static PriceLookup of(Map<String, BigDecimal> prices) {
    Map<String, BigDecimal> normalized = new HashMap<>();
    prices.forEach(
        (asset, price) -> {
          if (price != null && price.signum() < 0) {
            throw new InvalidInputException("price of " + asset + " must be >= 0");
          }
          normalized.put(Currency.normalizeCode(asset), price);
        });
    return asset -> Optional.ofNullable(normalized.get(Currency.normalizeCode(asset)));
  }
}
