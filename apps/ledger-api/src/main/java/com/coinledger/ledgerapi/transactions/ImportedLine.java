package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.LedgerErrorCode;

/**
 * Outcome of one CSV data line.
 *
 * @param line 1-based physical line number, the header being line 1
 * @param transactionId id of the appended transaction, {@code null} when rejected
 * @param code error code of a rejected line, {@code null} when imported
 */
public record ImportedLine(long line, Long transactionId, LedgerErrorCode code, String message) {

  static ImportedLine imported(long line, Long transactionId) {
    return new ImportedLine(line, transactionId, null, null);
  }

  static ImportedLine rejected(long line, LedgerErrorCode code, String message) {
    return new ImportedLine(line, null, code, message);
  }

  public boolean isImported() {
    return code == null;
  }
}
