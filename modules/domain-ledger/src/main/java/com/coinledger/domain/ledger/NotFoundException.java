package com.coinledger.domain.ledger;

public class NotFoundException extends LedgerDomainException {
  private final String resource;
  private final String key;

  public NotFoundException(String resource, String key) {
    super(LedgerErrorCode.NOT_FOUND, resource + " not found: " + key);
    this.resource = resource;
    this.key = key;
  }

  public String resource() {
    return resource;
  }

  public String key() {
    return key;
  }
}
