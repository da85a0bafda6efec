package com.p2pescrow.escrowapi.offers;

import com.p2pescrow.domain.escrow.Offer;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOfferRepository implements OfferRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id,
             seller,
             max_trade_amount,
             min_trade_amount,
             unit_price,
             currency,
             payment_method,
             open_escrow_count,
             active,
             created_at
      FROM offers
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcOfferRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long nextId() {
    Long id = jdbcTemplate.queryForObject("SELECT nextval('offers_id_seq')", Long.class);
    if (id == null) {
      throw new IllegalStateException("offers_id_seq returned no value");
    }
    return id;
  }

  @Override
  public void insert(Offer offer) {
    String sql =
        """
        INSERT INTO offers (
            id,
            seller,
            max_trade_amount,
            min_trade_amount,
            unit_price,
            currency,
            payment_method,
            open_escrow_count,
            active,
            created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        offer.id(),
        offer.seller(),
        new BigDecimal(offer.maxTradeAmount()),
        new BigDecimal(offer.minTradeAmount()),
        new BigDecimal(offer.unitPrice()),
        offer.currency(),
        offer.paymentMethod(),
        offer.openEscrowCount(),
        offer.active(),
        Timestamp.from(offer.createdAt()));
  }

  @Override
  public Optional<Offer> findById(long offerId) {
    return first(jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", this::mapRow, offerId));
  }

  @Override
  public Optional<Offer> findByIdForUpdate(long offerId) {
    return first(
        jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? FOR UPDATE", this::mapRow, offerId));
  }

  @Override
  public void update(Offer offer) {
    String sql =
        """
        UPDATE offers
        SET open_escrow_count = ?,
            active = ?
        WHERE id = ?
        """;
    jdbcTemplate.update(sql, offer.openEscrowCount(), offer.active(), offer.id());
  }

  @Override
  public List<Offer> findBySeller(String seller) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "WHERE seller = ? ORDER BY id ASC", this::mapRow, seller);
  }

  @Override
  public List<Offer> findActive(int offset, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "WHERE active = TRUE ORDER BY id ASC LIMIT ? OFFSET ?",
        this::mapRow,
        limit,
        offset);
  }

  private Offer mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Offer(
        rs.getLong("id"),
        rs.getString("seller"),
        rs.getBigDecimal("max_trade_amount").toBigIntegerExact(),
        rs.getBigDecimal("min_trade_amount").toBigIntegerExact(),
        rs.getBigDecimal("unit_price").toBigIntegerExact(),
        rs.getString("currency"),
        rs.getString("payment_method"),
        rs.getInt("open_escrow_count"),
        rs.getBoolean("active"),
        rs.getTimestamp("created_at").toInstant());
  }

  private static Optional<Offer> first(List<Offer> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
