package com.coinledger.ledgerapi.currency;

import com.coinledger.domain.ledger.AssetClass;
import com.coinledger.domain.ledger.Currency;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcCurrencyRepository implements CurrencyRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcCurrencyRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean exists(String code) {
    String sql = "SELECT EXISTS(SELECT 1 FROM currencies WHERE code = ?)";
    Boolean exists = jdbcTemplate.queryForObject(sql, Boolean.class, code);
    return Boolean.TRUE.equals(exists);
  }

  @Override
  public Optional<Currency> findByCode(String code) {
    String sql =
        """
        SELECT code, name, symbol, decimals, asset_class, enabled, created_at, updated_at
        FROM currencies
        WHERE code = ?
        """;
    List<Currency> rows = jdbcTemplate.query(sql, this::mapCurrency, code);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Currency> findAll() {
    String sql =
        """
        SELECT code, name, symbol, decimals, asset_class, enabled, created_at, updated_at
        FROM currencies
        ORDER BY code ASC
        """;
    return jdbcTemplate.query(sql, this::mapCurrency);
  }

  @Override
  public boolean insert(Currency currency) {
    String sql =
        """
        INSERT INTO currencies (code, name, symbol, decimals, asset_class, enabled, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (code) DO NOTHING
        """;
    int inserted =
        jdbcTemplate.update(
            sql,
            currency.code(),
            currency.name(),
            currency.symbol(),
            currency.decimals(),
            currency.assetClass().dbValue(),
            currency.enabled(),
            Timestamp.from(currency.createdAt()),
            Timestamp.from(currency.updatedAt()));
    return inserted == 1;
  }

  @Override
  public boolean updateEnabled(String code, boolean enabled, Instant updatedAt) {
    String sql =
        """
        UPDATE currencies
        SET enabled = ?, updated_at = ?
        WHERE code = ?
        """;
    return jdbcTemplate.update(sql, enabled, Timestamp.from(updatedAt), code) == 1;
  }

  private Currency mapCurrency(ResultSet rs, int rowNum) throws SQLException {
    return new Currency(
        rs.getString("code"),
        rs.getString("name"),
        rs.getString("symbol"),
        rs.getInt("decimals"),
        AssetClass.parse(rs.getString("asset_class")),
        rs.getBoolean("enabled"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
