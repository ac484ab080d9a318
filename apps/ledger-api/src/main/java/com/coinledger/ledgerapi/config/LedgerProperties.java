package com.coinledger.ledgerapi.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {
  private String costBasisCurrency = "USD";
  private Rates rates = new Rates();
  private Transactions transactions = new Transactions();

  public String getCostBasisCurrency() {
    return costBasisCurrency;
  }

  public void setCostBasisCurrency(String costBasisCurrency) {
    this.costBasisCurrency = costBasisCurrency;
  }

  public Rates getRates() {
    return rates;
  }

  public void setRates(Rates rates) {
    this.rates = rates;
  }

  public Transactions getTransactions() {
    return transactions;
  }

  public void setTransactions(Transactions transactions) {
    this.transactions = transactions;
  }

  public static class Rates {
    /** Rates older than this, relative to the lookup instant, are not used for conversion. */
    private Duration maxAge = Duration.ofDays(30);

    private int historyPageSize = 100;

    public Duration getMaxAge() {
      return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
    }

    public int getHistoryPageSize() {
      return historyPageSize;
    }

    public void setHistoryPageSize(int historyPageSize) {
      this.historyPageSize = historyPageSize;
    }
  }

  public static class Transactions {
    private int defaultListLimit = 50;
    private int maxListLimit = 500;

    public int getDefaultListLimit() {
      return defaultListLimit;
    }

    public void setDefaultListLimit(int defaultListLimit) {
      this.defaultListLimit = defaultListLimit;
    }

    public int getMaxListLimit() {
      return maxListLimit;
    }

    public void setMaxListLimit(int maxListLimit) {
      this.maxListLimit = maxListLimit;
    }

    public int clampLimit(Integer requested) {
      if (requested == null || requested <= 0) {
        return defaultListLimit;
      }
      return Math.min(requested, maxListLimit);
    }
  }
}
