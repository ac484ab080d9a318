package com.coinledger.ledgerapi.accounts;

import com.coinledger.domain.ledger.AccountNotFoundException;
import com.coinledger.domain.ledger.InvalidInputException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAccountRegistry implements AccountRegistry {
  private static final Pattern UUID_PATTERN =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
  private static final String SELECT_ACCOUNTS =
      """
      SELECT a.id, a.name, a.account_type, a.category_id, c.name AS category_name
      FROM accounts a
      LEFT JOIN categories c ON c.id = a.category_id
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcAccountRegistry(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public AccountView resolve(String nameOrId) {
    if (nameOrId == null || nameOrId.isBlank()) {
      throw new InvalidInputException("account reference must not be blank");
    }
    String reference = nameOrId.trim();
    UUID id = parseUuid(reference);
    List<AccountView> rows =
        id != null
            ? jdbcTemplate.query(SELECT_ACCOUNTS + " WHERE a.id = ?", this::mapAccount, id)
            : jdbcTemplate.query(
                SELECT_ACCOUNTS + " WHERE LOWER(a.name) = LOWER(?)", this::mapAccount, reference);
    if (rows.isEmpty()) {
      throw new AccountNotFoundException(
          reference, listAll().stream().map(AccountView::name).toList());
    }
    return rows.get(0);
  }

  @Override
  public List<AccountView> listAll() {
    return jdbcTemplate.query(SELECT_ACCOUNTS + " ORDER BY a.name ASC", this::mapAccount);
  }

  private static UUID parseUuid(String value) {
    return UUID_PATTERN.matcher(value).matches() ? UUID.fromString(value) : null;
  }

  private AccountView mapAccount(ResultSet rs, int rowNum) throws SQLException {
    return new AccountView(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getString("account_type"),
        rs.getObject("category_id", UUID.class),
        rs.getString("category_name"));
  }
}
