package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.AssetClass;
import com.coinledger.domain.ledger.Currency;
import com.coinledger.ledgerapi.currency.CurrencyCatalog;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/currencies")
public class CurrencyController {
  private final CurrencyCatalog currencyCatalog;

  public CurrencyController(CurrencyCatalog currencyCatalog) {
    this.currencyCatalog = currencyCatalog;
  }

  @GetMapping
  public ResponseEntity<List<CurrencyResponse>> listCurrencies(
      @RequestParam(name = "assetClass", required = false) String assetClass,
      @RequestParam(name = "enabledOnly", defaultValue = "false") boolean enabledOnly) {
    AssetClass filter =
        assetClass == null || assetClass.isBlank() ? null : AssetClass.parse(assetClass);
    List<CurrencyResponse> currencies =
        currencyCatalog.list(filter, enabledOnly).stream().map(CurrencyResponse::from).toList();
    return ResponseEntity.ok(currencies);
  }

  @PostMapping
  public ResponseEntity<CurrencyResponse> registerCurrency(
      @Valid @RequestBody RegisterCurrencyRequest request) {
    Currency currency =
        currencyCatalog.register(
            request.code(),
            request.name(),
            request.symbol(),
            request.decimals(),
            AssetClass.parse(request.assetClass()));
    return ResponseEntity.status(HttpStatus.CREATED).body(CurrencyResponse.from(currency));
  }

  @GetMapping("/{code}")
  public ResponseEntity<CurrencyResponse> getCurrency(@PathVariable("code") String code) {
    return ResponseEntity.ok(CurrencyResponse.from(currencyCatalog.get(code)));
  }

  @PutMapping("/{code}/enabled")
  public ResponseEntity<CurrencyResponse> setEnabled(
      @PathVariable("code") String code, @Valid @RequestBody SetCurrencyEnabledRequest request) {
    return ResponseEntity.ok(
        CurrencyResponse.from(currencyCatalog.setEnabled(code, request.enabled())));
  }
}
