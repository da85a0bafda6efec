package com.p2pescrow.escrowapi.escrows;

import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.domain.escrow.EscrowStatus;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcEscrowRepository implements EscrowRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id,
             offer_id,
             buyer,
             seller,
             amount,
             fiat_amount,
             created_at,
             status
      FROM escrows
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcEscrowRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long nextId() {
    Long id = jdbcTemplate.queryForObject("SELECT nextval('escrows_id_seq')", Long.class);
    if (id == null) {
      throw new IllegalStateException("escrows_id_seq returned no value");
    }
    return id;
  }

  @Override
  public void insert(Escrow escrow) {
    String sql =
        """
        INSERT INTO escrows (
            id,
            offer_id,
            buyer,
            seller,
            amount,
            fiat_amount,
            status,
            created_at,
            updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    Timestamp createdAt = Timestamp.from(escrow.createdAt());
    jdbcTemplate.update(
        sql,
        escrow.id(),
        escrow.offerId(),
        escrow.buyer(),
        escrow.seller(),
        new BigDecimal(escrow.amount()),
        new BigDecimal(escrow.fiatAmount()),
        escrow.status().name(),
        createdAt,
        createdAt);
  }

  @Override
  public Optional<Escrow> findById(long escrowId) {
    return first(jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", this::mapRow, escrowId));
  }

  @Override
  public Optional<Escrow> findByIdForUpdate(long escrowId) {
    return first(
        jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? FOR UPDATE", this::mapRow, escrowId));
  }

  @Override
  public void update(Escrow escrow) {
    jdbcTemplate.update(
        "UPDATE escrows SET status = ?, updated_at = NOW() WHERE id = ?",
        escrow.status().name(),
        escrow.id());
  }

  @Override
  public List<Escrow> findByParticipant(String principal) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "WHERE buyer = ? OR seller = ? ORDER BY id ASC",
        this::mapRow,
        principal,
        principal);
  }

  private Escrow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Escrow(
        rs.getLong("id"),
        rs.getLong("offer_id"),
        rs.getString("buyer"),
        rs.getString("seller"),
        rs.getBigDecimal("amount").toBigIntegerExact(),
        rs.getBigDecimal("fiat_amount").toBigIntegerExact(),
        rs.getTimestamp("created_at").toInstant(),
        EscrowStatus.valueOf(rs.getString("status")));
  }

  private static Optional<Escrow> first(List<Escrow> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
