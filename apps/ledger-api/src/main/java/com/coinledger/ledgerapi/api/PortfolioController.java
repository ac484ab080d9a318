package com.coinledger.ledgerapi.api;

import com.coinledger.ledgerapi.portfolio.PortfolioAggregator;
import com.coinledger.ledgerapi.portfolio.PortfolioValuation;
import com.coinledger.ledgerapi.portfolio.PriceLookup;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/portfolio")
public class PortfolioController {
  private final PortfolioAggregator portfolioAggregator;

  public PortfolioController(PortfolioAggregator portfolioAggregator) {
    this.portfolioAggregator = portfolioAggregator;
  }

  @PostMapping("/valuation")
  public ResponseEntity<PortfolioValuation> valuePortfolio(
      @Valid @RequestBody PortfolioValuationRequest request) {
    return ResponseEntity.ok(portfolioAggregator.value(PriceLookup.of(request.prices())));
  }
}
