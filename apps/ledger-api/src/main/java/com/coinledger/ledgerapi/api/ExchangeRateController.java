package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.ExchangeRate;
import com.coinledger.ledgerapi.rates.ExchangeRateStore;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/rates")
public class ExchangeRateController {
  private static final int MAX_HISTORY_LIMIT = 1000;

  private final ExchangeRateStore exchangeRateStore;
  private final Clock clock;

  public ExchangeRateController(ExchangeRateStore exchangeRateStore, Clock clock) {
    this.exchangeRateStore = exchangeRateStore;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<ExchangeRateResponse> upsertRate(
      @Valid @RequestBody UpsertRateRequest request) {
    ExchangeRate rate =
        new ExchangeRate(
            null,
            request.from(),
            request.to(),
            request.rate(),
            request.timestamp() != null ? request.timestamp() : clock.instant(),
            request.source(),
            request.notes(),
            null);
    long id = exchangeRateStore.upsert(rate);
    ExchangeRate stored =
        new ExchangeRate(
            id,
            rate.fromCurrency(),
            rate.toCurrency(),
            rate.rate(),
            rate.timestamp(),
            rate.source(),
            rate.notes(),
            null);
    return ResponseEntity.status(HttpStatus.CREATED).body(ExchangeRateResponse.from(stored));
  }

  @GetMapping("/{from}/{to}/latest")
  public ResponseEntity<ExchangeRateResponse> latest(
      @PathVariable("from") String from, @PathVariable("to") String to) {
    return ResponseEntity.ok(ExchangeRateResponse.from(exchangeRateStore.latest(from, to)));
  }

  @GetMapping("/{from}/{to}/as-of")
  public ResponseEntity<ExchangeRateResponse> asOf(
      @PathVariable("from") String from,
      @PathVariable("to") String to,
      @RequestParam("at") Instant at) {
    return ResponseEntity.ok(ExchangeRateResponse.from(exchangeRateStore.asOf(from, to, at)));
  }

  @GetMapping("/{from}/{to}/history")
  public ResponseEntity<List<ExchangeRateResponse>> history(
      @PathVariable("from") String from,
      @PathVariable("to") String to,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    int effectiveLimit = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
    List<ExchangeRateResponse> rates =
        exchangeRateStore.history(from, to).first(effectiveLimit).stream()
            .map(ExchangeRateResponse::from)
            .toList();
    return ResponseEntity.ok(rates);
  }
}
