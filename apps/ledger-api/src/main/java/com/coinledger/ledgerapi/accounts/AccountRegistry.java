package com.coinledger.ledgerapi.accounts;

import java.util.List;

/** Resolves account references. Accounts are created and edited outside the ledger. */
public interface AccountRegistry {
  /**
   * Resolves an account id or a case-insensitive account name.
   *
   * @throws com.coinledger.domain.ledger.AccountNotFoundException when nothing matches
   */
  AccountView resolve(String nameOrId);

  List<AccountView> listAll();
}
