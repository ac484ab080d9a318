package com.coinledger.ledgerapi.portfolio;

import com.coinledger.ledgerapi.holdings.HoldingsLedger;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only valuation of open holdings at caller-supplied prices. */
@Service
public class PortfolioAggregator {
  static final String UNCATEGORIZED = "Uncategorized";

  private final PortfolioReadRepository portfolioReadRepository;
  private final HoldingsLedger holdingsLedger;
  private final Clock clock;

  public PortfolioAggregator(
      PortfolioReadRepository portfolioReadRepository, HoldingsLedger holdingsLedger, Clock clock) {
    this.portfolioReadRepository = portfolioReadRepository;
    this.holdingsLedger = holdingsLedger;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public PortfolioValuation value(PriceLookup prices) {
    Map<UUID, AccountGroup> accounts = new LinkedHashMap<>();
    Map<String, AssetGroup> assets = new LinkedHashMap<>();
    List<UnpricedHolding> unpriced = new ArrayList<>();

    for (PositionView position : portfolioReadRepository.findOpenPositions()) {
      if (position.quantity().signum() == 0) {
        continue;
      }
      Optional<BigDecimal> price = prices.priceOf(position.asset());
      if (price.isEmpty()) {
        unpriced.add(
            new UnpricedHolding(
                position.accountId(),
                position.accountName(),
                position.asset(),
                position.quantity()));
        continue;
      }
      HoldingValuation holding = valueHolding(position, price.get());
      accounts
          .computeIfAbsent(position.accountId(), id -> new AccountGroup(position))
          .holdings
          .add(holding);
      assets
          .computeIfAbsent(position.asset(), AssetGroup::new)
          .add(holding.quantity(), holding.totals());
    }

    Map<String, CategoryGroup> categories = new LinkedHashMap<>();
    for (AccountGroup account : accounts.values()) {
      categories
          .computeIfAbsent(account.categoryKey(), key -> new CategoryGroup(account))
          .accounts
          .add(account.toValuation());
    }

    List<CategoryValuation> categoryValuations =
        categories.values().stream()
            .map(CategoryGroup::toValuation)
            .sorted(
                Comparator.comparing(
                        (CategoryValuation category) -> category.totals().value(),
                        Comparator.reverseOrder())
                    .thenComparing(CategoryValuation::categoryName))
            .toList();
    List<AssetValuation> assetValuations =
        assets.values().stream()
            .map(AssetGroup::toValuation)
            .sorted(
                Comparator.comparing(
                        (AssetValuation asset) -> asset.totals().value(), Comparator.reverseOrder())
                    .thenComparing(AssetValuation::asset))
            .toList();
    ValuationTotals totals =
        categoryValuations.stream()
            .map(CategoryValuation::totals)
            .reduce(ValuationTotals.ZERO, ValuationTotals::plus);

    return new PortfolioValuation(
        holdingsLedger.costBasisCurrency(),
        totals,
        categoryValuations,
        assetValuations,
        List.copyOf(unpriced),
        clock.instant());
  }

  static HoldingValuation valueHolding(PositionView position, BigDecimal price) {
    BigDecimal value = position.quantity().multiply(price);
    BigDecimal cost = position.quantity().multiply(position.avgCostBasis());
    return new HoldingValuation(
        position.asset(),
        position.quantity(),
        position.avgCostBasis(),
        price,
        ValuationTotals.of(value, cost));
  }

  private static final class AccountGroup {
    private final UUID accountId;
    private final String accountName;
    private final UUID categoryId;
    private final String categoryName;
    private final List<HoldingValuation> holdings = new ArrayList<>();

    private AccountGroup(PositionView position) {
      this.accountId = position.accountId();
      this.accountName = position.accountName();
      this.categoryId = position.categoryId();
      this.categoryName =
          position.categoryName() == null ? UNCATEGORIZED : position.categoryName();
    }

    private String categoryKey() {
      return categoryId == null ? "" : categoryId.toString();
    }

    private AccountValuation toValuation() {
      List<HoldingValuation> sorted =
          holdings.stream()
              .sorted(
                  Comparator.comparing(
                          (HoldingValuation holding) -> holding.totals().value(),
                          Comparator.reverseOrder())
                      .thenComparing(HoldingValuation::asset))
              .toList();
      ValuationTotals totals =
          sorted.stream()
              .map(HoldingValuation::totals)
              .reduce(ValuationTotals.ZERO, ValuationTotals::plus);
      return new AccountValuation(accountId, accountName, totals, sorted);
    }
  }

  private static final class CategoryGroup {
    private final UUID categoryId;
    private final String categoryName;
    private final List<AccountValuation> accounts = new ArrayList<>();

    private CategoryGroup(AccountGroup first) {
      this.categoryId = first.categoryId;
      this.categoryName = first.categoryName;
    }

    private CategoryValuation toValuation() {
      List<AccountValuation> sorted =
          accounts.stream()
              .sorted(
                  Comparator.comparing(
                          (AccountValuation account) -> account.totals().value(),
                          Comparator.reverseOrder())
                      .thenComparing(AccountValuation::accountName))
              .toList();
      ValuationTotals totals =
          sorted.stream()
              .map(AccountValuation::totals)
              .reduce(ValuationTotals.ZERO, ValuationTotals::plus);
      return new CategoryValuation(categoryId, categoryName, totals, sorted);
    }
  }

  private static final class AssetGroup {
    private final String asset;
    private BigDecimal quantity = BigDecimal.ZERO;
    private ValuationTotals totals = ValuationTotals.ZERO;

    private AssetGroup(String asset) {
      this.asset = asset;
    }

    private void add(BigDecimal addedQuantity, ValuationTotals addedTotals) {
      quantity = quantity.add(addedQuantity);
      totals = totals.plus(addedTotals);
    }

    private AssetValuation toValuation() {
      return new AssetValuation(asset, quantity, totals);
    }
  }
}
