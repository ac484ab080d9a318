package com.coinledger.ledgerapi.api;

import com.coinledger.ledgerapi.transactions.ImportReport;
import com.coinledger.ledgerapi.transactions.ImportedLine;
import java.util.List;

public record ImportTransactionsResponse(
    String account, long imported, long rejected, List<LineResult> lines) {

  public static ImportTransactionsResponse from(ImportReport report) {
    return new ImportTransactionsResponse(
        report.accountName(),
        report.importedCount(),
        report.rejectedCount(),
        report.lines().stream().map(LineResult::from).toList());
  }

  public record LineResult(
      long line, String status, Long transactionId, String code, String message) {

    static LineResult from(ImportedLine line) {
      return new LineResult(
          line.line(),
          line.isImported() ? "imported" : "rejected",
          line.transactionId(),
          line.code() == null ? null : line.code().name(),
          line.message());
    }
  }
}
