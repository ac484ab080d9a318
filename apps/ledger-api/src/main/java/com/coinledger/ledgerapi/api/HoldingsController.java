package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.Holding;
import com.coinledger.ledgerapi.accounts.AccountRegistry;
import com.coinledger.ledgerapi.holdings.HoldingsLedger;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/holdings")
public class HoldingsController {
  private final HoldingsLedger holdingsLedger;
  private final AccountRegistry accountRegistry;

  public HoldingsController(HoldingsLedger holdingsLedger, AccountRegistry accountRegistry) {
    this.holdingsLedger = holdingsLedger;
    this.accountRegistry = accountRegistry;
  }

  @GetMapping
  public ResponseEntity<List<HoldingResponse>> listHoldings(
      @RequestParam(name = "account", required = false) String account) {
    List<Holding> holdings =
        account == null || account.isBlank()
            ? holdingsLedger.listAll()
            : holdingsLedger.listByAccount(accountRegistry.resolve(account).id());
    return ResponseEntity.ok(holdings.stream().map(HoldingResponse::from).toList());
  }
}
