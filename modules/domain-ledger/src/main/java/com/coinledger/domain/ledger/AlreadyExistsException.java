package com.coinledger.domain.ledger;

public class AlreadyExistsException extends LedgerDomainException {
  public AlreadyExistsException(String resource, String key) {
    super(LedgerErrorCode.ALREADY_EXISTS, resource + " already exists: " + key);
  }
}
