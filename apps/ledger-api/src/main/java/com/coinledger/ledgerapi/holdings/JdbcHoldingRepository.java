package com.coinledger.ledgerapi.holdings;

import com.coinledger.domain.ledger.Holding;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcHoldingRepository implements HoldingRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcHoldingRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<Holding> find(UUID accountId, String asset) {
    String sql =
        """
        SELECT account_id, asset, quantity, avg_cost_basis, cost_basis_currency, updated_at
        FROM holdings
        WHERE account_id = ? AND asset = ?
        """;
    List<Holding> rows = jdbcTemplate.query(sql, this::mapHolding, accountId, asset);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public Optional<Holding> findForUpdate(UUID accountId, String asset) {
    String sql =
        """
        SELECT account_id, asset, quantity, avg_cost_basis, cost_basis_currency, updated_at
        FROM holdings
        WHERE account_id = ? AND asset = ?
        FOR UPDATE
        """;
    List<Holding> rows = jdbcTemplate.query(sql, this::mapHolding, accountId, asset);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Holding> findByAccount(UUID accountId) {
    String sql =
        """
        SELECT account_id, asset, quantity, avg_cost_basis, cost_basis_currency, updated_at
        FROM holdings
        WHERE account_id = ?
        ORDER BY asset ASC
        """;
    return jdbcTemplate.query(sql, this::mapHolding, accountId);
  }

  @Override
  public List<Holding> findAll() {
    String sql =
        """
        SELECT account_id, asset, quantity, avg_cost_basis, cost_basis_currency, updated_at
        FROM holdings
        ORDER BY account_id ASC, asset ASC
        """;
    return jdbcTemplate.query(sql, this::mapHolding);
  }

  @Override
  public void insert(Holding holding) {
    String sql =
        """
        INSERT INTO holdings (account_id, asset, quantity, avg_cost_basis, cost_basis_currency, updated_at)
        VALUES (?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        holding.accountId(),
        holding.asset(),
        holding.quantity(),
        holding.avgCostBasis(),
        holding.costBasisCurrency(),
        Timestamp.from(holding.updatedAt()));
  }

  @Override
  public void update(Holding holding) {
    String sql =
        """
        UPDATE holdings
        SET quantity = ?, avg_cost_basis = ?, cost_basis_currency = ?, updated_at = ?
        WHERE account_id = ? AND asset = ?
        """;
    jdbcTemplate.update(
        sql,
        holding.quantity(),
        holding.avgCostBasis(),
        holding.costBasisCurrency(),
        Timestamp.from(holding.updatedAt()),
        holding.accountId(),
        holding.asset());
  }

  private Holding mapHolding(ResultSet rs, int rowNum) throws SQLException {
    return new Holding(
        rs.getObject("account_id", UUID.class),
        rs.getString("asset"),
        rs.getBigDecimal("quantity"),
        rs.getBigDecimal("avg_cost_basis"),
        rs.getString("cost_basis_currency"),
        rs.getTimestamp("updated_at").toInstant());
  }
}
