package com.coinledger.domain.ledger;

public class LedgerArithmeticException extends LedgerDomainException {
  public LedgerArithmeticException(String message) {
    super(LedgerErrorCode.ARITHMETIC_ERROR, message);
  }
}
