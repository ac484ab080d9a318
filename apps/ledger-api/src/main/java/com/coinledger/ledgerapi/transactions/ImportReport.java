package com.coinledger.ledgerapi.transactions;

import java.util.List;

public record ImportReport(String accountName, List<ImportedLine> lines) {

  public ImportReport {
    lines = List.copyOf(lines);
  }

  public long importedCount() {
    return lines.stream().filter(ImportedLine::isImported).count();
  }

  public long rejectedCount() {
    return lines.size() - importedCount();
  }
}
