package com.p2pescrow.escrowapi.balances;

import com.p2pescrow.domain.balance.SellerBalance;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcBalanceRepository implements BalanceRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcBalanceRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<SellerBalance> findByPrincipal(String principal) {
    String sql = "SELECT principal, deposited, locked FROM seller_balances WHERE principal = ?";
    return first(jdbcTemplate.query(sql, this::mapBalance, principal));
  }

  @Override
  public Optional<SellerBalance> findByPrincipalForUpdate(String principal) {
    String sql =
        """
        SELECT principal, deposited, locked
        FROM seller_balances
        WHERE principal = ?
        FOR UPDATE
        """;
    return first(jdbcTemplate.query(sql, this::mapBalance, principal));
  }

  @Override
  public SellerBalance lockOrCreate(String principal) {
    jdbcTemplate.update(
        """
        INSERT INTO seller_balances (principal, deposited, locked, updated_at)
        VALUES (?, 0, 0, NOW())
        ON CONFLICT (principal) DO NOTHING
        """,
        principal);
    return findByPrincipalForUpdate(principal)
        .orElseThrow(() -> new IllegalStateException("No balance row for " + principal));
  }

  @Override
  public void update(SellerBalance balance) {
    String sql =
        """
        UPDATE seller_balances
        SET deposited = ?, locked = ?, updated_at = NOW()
        WHERE principal = ?
        """;
    jdbcTemplate.update(
        sql,
        new BigDecimal(balance.deposited()),
        new BigDecimal(balance.locked()),
        balance.principal());
  }

  private SellerBalance mapBalance(ResultSet rs, int rowNum) throws SQLException {
    return new SellerBalance(
        rs.getString("principal"),
        rs.getBigDecimal("deposited").toBigIntegerExact(),
        rs.getBigDecimal("locked").toBigIntegerExact());
  }

  private static Optional<SellerBalance> first(List<SellerBalance> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
