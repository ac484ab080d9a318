package com.coinledger.domain.ledger;

import java.util.List;

public class AccountNotFoundException extends NotFoundException {
  private final List<String> knownAccounts;

  public AccountNotFoundException(String reference, List<String> knownAccounts) {
    super("Account", reference);
    this.knownAccounts = knownAccounts == null ? List.of() : List.copyOf(knownAccounts);
  }

  /** Names of the accounts that do exist, for "did you mean" style messages. */
  public List<String> knownAccounts() {
    return knownAccounts;
  }
}
