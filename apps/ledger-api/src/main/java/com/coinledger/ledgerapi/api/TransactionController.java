package com.coinledger.ledgerapi.api;

import com.coinledger.domain.ledger.TransactionCommand;
import com.coinledger.domain.ledger.TransactionRecord;
import com.coinledger.ledgerapi.transactions.CsvTransactionImporter;
import com.coinledger.ledgerapi.transactions.RecordedTransaction;
import com.coinledger.ledgerapi.transactions.TransactionRecorder;
import jakarta.validation.Valid;
import java.io.StringReader;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/transactions")
public class TransactionController {
  private final TransactionRecorder transactionRecorder;
  private final CsvTransactionImporter csvTransactionImporter;

  public TransactionController(
      TransactionRecorder transactionRecorder, CsvTransactionImporter csvTransactionImporter) {
    this.transactionRecorder = transactionRecorder;
    this.csvTransactionImporter = csvTransactionImporter;
  }

  @PostMapping
  public ResponseEntity<RecordTransactionResponse> recordTransaction(
      @Valid @RequestBody RecordTransactionRequest request,
      @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
    TransactionCommand command = request.toCommand();
    if (dryRun) {
      RecordedTransaction preview = transactionRecorder.preview(command);
      return ResponseEntity.ok(RecordTransactionResponse.from(preview));
    }
    RecordedTransaction recorded = transactionRecorder.record(command);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(RecordTransactionResponse.from(recorded));
  }

  @PostMapping(
      path = "/import",
      consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
  public ResponseEntity<ImportTransactionsResponse> importTransactions(
      @RequestParam(name = "account") String account, @RequestBody String csv) {
    return ResponseEntity.ok(
        ImportTransactionsResponse.from(
            csvTransactionImporter.importCsv(account, new StringReader(csv))));
  }

  @GetMapping
  public ResponseEntity<List<TransactionResponse>> listTransactions(
      @RequestParam(name = "account", required = false) String account,
      @RequestParam(name = "limit", required = false) Integer limit) {
    List<TransactionRecord> records =
        account == null || account.isBlank()
            ? transactionRecorder.list(limit)
            : transactionRecorder.listByAccount(account, limit);
    return ResponseEntity.ok(records.stream().map(TransactionResponse::from).toList());
  }
}
