package com.coinledger.domain.ledger;

public enum LedgerErrorCode {
  NOT_FOUND,
  ALREADY_EXISTS,
  INVALID_INPUT,
  INSUFFICIENT_HOLDINGS,
  ARITHMETIC_ERROR,
  RATE_UNAVAILABLE,
  CONFLICT
}
