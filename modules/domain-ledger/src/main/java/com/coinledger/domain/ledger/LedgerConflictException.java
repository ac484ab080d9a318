package com.coinledger.domain.ledger;

/** Concurrent modification detected by the store; the caller may retry the whole operation. */
public class LedgerConflictException extends LedgerDomainException {
  public LedgerConflictException(String message, Throwable cause) {
    super(LedgerErrorCode.CONFLICT, message, cause);
  }
}
