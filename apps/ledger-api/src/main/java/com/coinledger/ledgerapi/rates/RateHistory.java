package com.coinledger.ledgerapi.rates;

import com.coinledger.domain.ledger.ExchangeRate;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Newest-first history of one directed currency pair. Pages are fetched on demand; every call to
 * {@link #iterator()} starts again from the newest rate.
 */
public final class RateHistory implements Iterable<ExchangeRate> {
  private final ExchangeRateRepository repository;
  private final String fromCurrency;
  private final String toCurrency;
  private final int pageSize;

  RateHistory(
      ExchangeRateRepository repository, String fromCurrency, String toCurrency, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    this.repository = repository;
    this.fromCurrency = fromCurrency;
    this.toCurrency = toCurrency;
    this.pageSize = pageSize;
  }

  public String fromCurrency() {
    return fromCurrency;
  }

  public String toCurrency() {
    return toCurrency;
  }

  @Override
  public Iterator<ExchangeRate> iterator() {
    return new PageIterator();
  }

  public Stream<ExchangeRate> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  public List<ExchangeRate> first(int limit) {
    return stream().limit(limit).toList();
  }

  private final class PageIterator implements Iterator<ExchangeRate> {
    private Iterator<ExchangeRate> page = List.<ExchangeRate>of().iterator();
    private Instant cursor;
    private boolean exhausted;

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      List<ExchangeRate> rows =
          repository.findPageBefore(fromCurrency, toCurrency, cursor, pageSize);
      if (rows.size() < pageSize) {
        exhausted = true;
      }
      if (rows.isEmpty()) {
        return false;
      }
      cursor = rows.get(rows.size() - 1).timestamp();
      page = rows.iterator();
      return true;
    }

    @Override
    public ExchangeRate next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.next();
    }
  }
}
