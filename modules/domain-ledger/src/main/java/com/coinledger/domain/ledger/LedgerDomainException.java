package com.coinledger.domain.ledger;

import java.util.Objects;

public class LedgerDomainException extends RuntimeException {
  private final LedgerErrorCode code;

  public LedgerDomainException(LedgerErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code must not be null");
  }

  public LedgerDomainException(LedgerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code must not be null");
  }

  public LedgerErrorCode code() {
    return code;
  }
}
