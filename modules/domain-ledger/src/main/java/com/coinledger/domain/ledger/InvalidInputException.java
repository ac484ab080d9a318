package com.coinledger.domain.ledger;

public class InvalidInputException extends LedgerDomainException {
  public InvalidInputException(String message) {
    super(LedgerErrorCode.INVALID_INPUT, message);
  }
}
