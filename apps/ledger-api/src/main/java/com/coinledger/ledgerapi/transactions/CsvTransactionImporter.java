package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.BuyCommand;
import com.coinledger.domain.ledger.InvalidInputException;
import com.coinledger.domain.ledger.LedgerDomainException;
import com.coinledger.domain.ledger.LedgerErrorCode;
import com.coinledger.domain.ledger.SellCommand;
import com.coinledger.domain.ledger.SwapCommand;
import com.coinledger.domain.ledger.TransactionCommand;
import com.coinledger.domain.ledger.TransactionType;
import com.coinledger.domain.ledger.TransferCommand;
import com.coinledger.ledgerapi.accounts.AccountRegistry;
import com.coinledger.ledgerapi.accounts.AccountView;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bulk-records transactions for one account from CSV. The header row names the columns:
 * {@code date}, {@code type}, {@code asset} and {@code quantity} are required; {@code price}
 * (or {@code price_usd}), {@code fee}, {@code fee_asset}, {@code notes}, {@code to_asset},
 * {@code to_quantity}, {@code to_account} and {@code external_id} are optional.
 *
 * <p>Each data line is recorded in its own transaction. A rejected line is reported and the
 * import continues with the next one.
 */
@Service
public class CsvTransactionImporter {
  private static final Logger log = LoggerFactory.getLogger(CsvTransactionImporter.class);

  private static final List<String> REQUIRED_COLUMNS = List.of("date", "type", "asset", "quantity");
  private static final DateTimeFormatter SPACED_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final AccountRegistry accountRegistry;
  private final TransactionRecorder transactionRecorder;

  public CsvTransactionImporter(
      AccountRegistry accountRegistry, TransactionRecorder transactionRecorder) {
    this.accountRegistry = accountRegistry;
    this.transactionRecorder = transactionRecorder;
  }

  /**
   * Imports every data line into {@code accountRef}, which is also the source account of sells,
   * transfers and swaps.
   *
   * @throws com.coinledger.domain.ledger.AccountNotFoundException when the account is unknown
   * @throws InvalidInputException when the input is empty or lacks a required column
   */
  public ImportReport importCsv(String accountRef, Reader csv) {
    AccountView account = accountRegistry.resolve(accountRef);
    List<ImportedLine> lines = new ArrayList<>();
    try (CSVReader reader = new CSVReaderBuilder(csv).build()) {
      Map<String, Integer> columns = readHeader(reader);
      while (true) {
        long line = reader.getLinesRead() + 1;
        String[] cells;
        try {
          cells = reader.readNext();
        } catch (IOException | CsvValidationException ex) {
          // the parser cannot resynchronise after a malformed record
          lines.add(ImportedLine.rejected(line, LedgerErrorCode.INVALID_INPUT, ex.getMessage()));
          break;
        }
        if (cells == null) {
          break;
        }
        if (!isBlank(cells)) {
          lines.add(importLine(line, new CsvRow(columns, cells), account));
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read CSV input", ex);
    }

    ImportReport report = new ImportReport(account.name(), lines);
    log.info(
        "Imported CSV into account={} imported={} rejected={}",
        account.name(),
        report.importedCount(),
        report.rejectedCount());
    return report;
  }

  private ImportedLine importLine(long line, CsvRow row, AccountView account) {
    try {
      RecordedTransaction recorded = transactionRecorder.record(toCommand(row, account));
      return ImportedLine.imported(line, recorded.transaction().id());
    } catch (LedgerDomainException ex) {
      log.debug("Rejected CSV line={} code={}: {}", line, ex.code(), ex.getMessage());
      return ImportedLine.rejected(line, ex.code(), ex.getMessage());
    }
  }

  private static TransactionCommand toCommand(CsvRow row, AccountView account) {
    TransactionType type = TransactionType.parse(row.required("type"));
    String accountRef = account.id().toString();
    String asset = row.required("asset");
    BigDecimal quantity = row.decimal("quantity");
    BigDecimal price = row.has("price") ? row.decimal("price") : row.decimal("price_usd");
    Instant timestamp = parseDate(row.required("date"));
    String notes = row.optional("notes");
    String externalId = row.optional("external_id");

    return switch (type) {
      case BUY -> new BuyCommand(
          accountRef, asset, quantity, price, timestamp, notes, externalId);
      case SELL -> new SellCommand(
          accountRef, asset, quantity, price, timestamp, notes, externalId);
      case TRANSFER -> new TransferCommand(
          accountRef,
          row.required("to_account"),
          asset,
          quantity,
          row.decimal("fee"),
          row.optional("fee_asset"),
          timestamp,
          notes,
          externalId);
      case SWAP -> new SwapCommand(
          accountRef,
          row.optional("to_account"),
          asset,
          quantity,
          row.required("to_asset"),
          row.decimal("to_quantity"),
          null,
          timestamp,
          notes,
          externalId);
    };
  }

  /** Accepts RFC 3339, {@code yyyy-MM-dd HH:mm:ss} in UTC, or a bare date at UTC midnight. */
  static Instant parseDate(String value) {
    try {
      if (value.indexOf('T') > 0) {
        return OffsetDateTime.parse(value).toInstant();
      }
      if (value.indexOf(' ') > 0) {
        return LocalDateTime.parse(value, SPACED_DATE_TIME).toInstant(ZoneOffset.UTC);
      }
      return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException ex) {
      throw new InvalidInputException("Invalid date format: " + value);
    }
  }

  private static Map<String, Integer> readHeader(CSVReader reader) {
    String[] header;
    try {
      header = reader.readNext();
    } catch (IOException | CsvValidationException ex) {
      throw new InvalidInputException("Malformed CSV header: " + ex.getMessage());
    }
    if (header == null || isBlank(header)) {
      throw new InvalidInputException("CSV input has no header row");
    }
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 0; i < header.length; i++) {
      // strip a UTF-8 byte order mark left by spreadsheet exports
      String name = header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
      columns.putIfAbsent(name, i);
    }
    List<String> missing =
        REQUIRED_COLUMNS.stream().filter(column -> !columns.containsKey(column)).toList();
    if (!missing.isEmpty()) {
      throw new InvalidInputException("CSV header is missing columns: " + missing);
    }
    return columns;
  }

  private static boolean isBlank(String[] cells) {
    for (String cell : cells) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }

  private record CsvRow(Map<String, Integer> columns, String[] cells) {

    boolean has(String column) {
      return optional(column) != null;
    }

    String optional(String column) {
      Integer index = columns.get(column);
      if (index == null || index >= cells.length || cells[index] == null) {
        return null;
      }
      String value = cells[index].trim();
      return value.isEmpty() ? null : value;
    }

    String required(String column) {
      String value = optional(column);
      if (value == null) {
        throw new InvalidInputException(column + " is required");
      }
      return value;
    }

    BigDecimal decimal(String column) {
      String value = optional(column);
      if (value == null) {
        return null;
      }
      try {
        return new BigDecimal(value);
      } catch (NumberFormatException ex) {
        throw new InvalidInputException("Invalid " + column + ": " + value);
      }
    }
  }
}
