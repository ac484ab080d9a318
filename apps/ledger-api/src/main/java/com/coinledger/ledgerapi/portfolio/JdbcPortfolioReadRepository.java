package com.coinledger.ledgerapi.portfolio;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPortfolioReadRepository implements PortfolioReadRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcPortfolioReadRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public List<PositionView> findOpenPositions() {
    String sql =
        """
        SELECT h.account_id, a.name AS account_name, a.category_id, c.name AS category_name,
               h.asset, h.quantity, h.avg_cost_basis
        FROM holdings h
        JOIN accounts a ON a.id = h.account_id
        LEFT JOIN categories c ON c.id = a.category_id
        WHERE h.quantity > 0
        ORDER BY a.name ASC, h.asset ASC
        """;
    return jdbcTemplate.query(sql, this::mapPosition);
  }

  private PositionView mapPosition(ResultSet rs, int rowNum) throws SQLException {
    return new PositionView(
        rs.getObject("account_id", UUID.class),
        rs.getString("account_name"),
        rs.getObject("category_id", UUID.class),
        rs.getString("category_name"),
        rs.getString("asset"),
        rs.getBigDecimal("quantity"),
        rs.getBigDecimal("avg_cost_basis"));
  }
}
