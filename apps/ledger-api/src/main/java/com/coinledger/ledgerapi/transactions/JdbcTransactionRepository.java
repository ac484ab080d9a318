package com.coinledger.ledgerapi.transactions;

import com.coinledger.domain.ledger.TransactionRecord;
import com.coinledger.domain.ledger.TransactionType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTransactionRepository implements TransactionRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id, tx_type, from_account_id, from_asset, from_quantity, to_account_id, to_asset,
             to_quantity, unit_price, price_currency, fee, fee_asset, exchange_rate,
             exchange_rate_pair, external_id, notes, occurred_at, created_at
      FROM transactions
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcTransactionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean existsByExternalId(String externalId) {
    String sql = "SELECT EXISTS(SELECT 1 FROM transactions WHERE external_id = ?)";
    Boolean exists = jdbcTemplate.queryForObject(sql, Boolean.class, externalId);
    return Boolean.TRUE.equals(exists);
  }

  @Override
  public TransactionRecord insert(TransactionRecord record) {
    String sql =
        """
        INSERT INTO transactions (
          tx_type, from_account_id, from_asset, from_quantity, to_account_id, to_asset, to_quantity,
          unit_price, price_currency, fee, fee_asset, exchange_rate, exchange_rate_pair,
          external_id, notes, occurred_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING id, created_at
        """;
    return jdbcTemplate.queryForObject(
        sql,
        (rs, rowNum) -> record.withId(rs.getLong("id"), rs.getTimestamp("created_at").toInstant()),
        record.type().dbValue(),
        record.fromAccountId(),
        record.fromAsset(),
        record.fromQuantity(),
        record.toAccountId(),
        record.toAsset(),
        record.toQuantity(),
        record.unitPrice(),
        record.priceCurrency(),
        record.fee(),
        record.feeAsset(),
        record.exchangeRate(),
        record.exchangeRatePair(),
        record.externalId(),
        record.notes(),
        Timestamp.from(record.timestamp()));
  }

  @Override
  public List<TransactionRecord> findRecent(int limit) {
    String sql = SELECT_COLUMNS + " ORDER BY occurred_at DESC, id DESC LIMIT ?";
    return jdbcTemplate.query(sql, this::mapRecord, limit);
  }

  @Override
  public List<TransactionRecord> findByAccount(UUID accountId, int limit) {
    String sql =
        SELECT_COLUMNS
            + " WHERE from_account_id = ? OR to_account_id = ?"
            + " ORDER BY occurred_at DESC, id DESC LIMIT ?";
    return jdbcTemplate.query(sql, this::mapRecord, accountId, accountId, limit);
  }

  private TransactionRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new TransactionRecord(
        rs.getLong("id"),
        TransactionType.parse(rs.getString("tx_type")),
        rs.getObject("from_account_id", UUID.class),
        rs.getString("from_asset"),
        rs.getBigDecimal("from_quantity"),
        rs.getObject("to_account_id", UUID.class),
        rs.getString("to_asset"),
        rs.getBigDecimal("to_quantity"),
        rs.getBigDecimal("unit_price"),
        rs.getString("price_currency"),
        rs.getBigDecimal("fee"),
        rs.getString("fee_asset"),
        rs.getBigDecimal("exchange_rate"),
        rs.getString("exchange_rate_pair"),
        rs.getString("external_id"),
        rs.getString("notes"),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getTimestamp("created_at").toInstant());
  }
}
