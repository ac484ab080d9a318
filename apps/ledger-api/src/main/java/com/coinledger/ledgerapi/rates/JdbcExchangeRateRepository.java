package com.coinledger.ledgerapi.rates;

import com.coinledger.domain.ledger.ExchangeRate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcExchangeRateRepository implements ExchangeRateRepository {
  private static final String SELECT_COLUMNS =
      "SELECT id, from_currency, to_currency, rate, effective_at, source, notes, created_at"
          + " FROM exchange_rates";

  private final JdbcTemplate jdbcTemplate;

  public JdbcExchangeRateRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long upsert(ExchangeRate rate) {
    String sql =
        """
        INSERT INTO exchange_rates (from_currency, to_currency, rate, effective_at, source, notes)
        VALUES (?, ?, ?, ?, ?, ?)
        ON CONFLICT (from_currency, to_currency, effective_at)
        DO UPDATE SET rate = EXCLUDED.rate, source = EXCLUDED.source, notes = EXCLUDED.notes
        RETURNING id
        """;
    Long id =
        jdbcTemplate.queryForObject(
            sql,
            Long.class,
            rate.fromCurrency(),
            rate.toCurrency(),
            rate.rate(),
            Timestamp.from(rate.timestamp()),
            rate.source(),
            rate.notes());
    if (id == null) {
      throw new IllegalStateException("Exchange rate upsert returned no id for " + rate.pair());
    }
    return id;
  }

  @Override
  public Optional<ExchangeRate> findLatest(String fromCurrency, String toCurrency) {
    String sql =
        SELECT_COLUMNS
            + " WHERE from_currency = ? AND to_currency = ?"
            + " ORDER BY effective_at DESC LIMIT 1";
    List<ExchangeRate> rows = jdbcTemplate.query(sql, this::mapRate, fromCurrency, toCurrency);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public Optional<ExchangeRate> findAsOf(String fromCurrency, String toCurrency, Instant at) {
    String sql =
        SELECT_COLUMNS
            + " WHERE from_currency = ? AND to_currency = ? AND effective_at <= ?"
            + " ORDER BY effective_at DESC LIMIT 1";
    List<ExchangeRate> rows =
        jdbcTemplate.query(sql, this::mapRate, fromCurrency, toCurrency, Timestamp.from(at));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<ExchangeRate> findPageBefore(
      String fromCurrency, String toCurrency, Instant before, int limit) {
    if (before == null) {
      String sql =
          SELECT_COLUMNS
              + " WHERE from_currency = ? AND to_currency = ?"
              + " ORDER BY effective_at DESC LIMIT ?";
      return jdbcTemplate.query(sql, this::mapRate, fromCurrency, toCurrency, limit);
    }
    String sql =
        SELECT_COLUMNS
            + " WHERE from_currency = ? AND to_currency = ? AND effective_at < ?"
            + " ORDER BY effective_at DESC LIMIT ?";
    return jdbcTemplate.query(
        sql, this::mapRate, fromCurrency, toCurrency, Timestamp.from(before), limit);
  }

  private ExchangeRate mapRate(ResultSet rs, int rowNum) throws SQLException {
    Timestamp createdAt = rs.getTimestamp("created_at");
    return new ExchangeRate(
        rs.getLong("id"),
        rs.getString("from_currency"),
        rs.getString("to_currency"),
        rs.getBigDecimal("rate"),
        rs.getTimestamp("effective_at").toInstant(),
        rs.getString("source"),
        rs.getString("notes"),
        createdAt != null ? createdAt.toInstant() : null);
  }
}
