package com.p2pescrow.escrowapi.profiles;

import com.p2pescrow.domain.escrow.Profile;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcProfileRepository implements ProfileRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT principal,
             display_name,
             primary_contact,
             secondary_contact,
             joined_at,
             total_trades,
             completed_trades,
             disputed_trades,
             average_settlement_seconds
      FROM profiles
      WHERE principal = ?
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcProfileRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean exists(String principal) {
    Boolean exists =
        jdbcTemplate.queryForObject(
            "SELECT EXISTS(SELECT 1 FROM profiles WHERE principal = ?)", Boolean.class, principal);
    return Boolean.TRUE.equals(exists);
  }

  @Override
  public Optional<Profile> findByPrincipal(String principal) {
    return first(jdbcTemplate.query(SELECT_COLUMNS, this::mapRow, principal));
  }

  @Override
  public Optional<Profile> findByPrincipalForUpdate(String principal) {
    return first(jdbcTemplate.query(SELECT_COLUMNS + " FOR UPDATE", this::mapRow, principal));
  }

  @Override
  public void insert(Profile profile) {
    String sql =
        """
        INSERT INTO profiles (
            principal,
            display_name,
            primary_contact,
            secondary_contact,
            joined_at,
            total_trades,
            completed_trades,
            disputed_trades,
            average_settlement_seconds
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        profile.principal(),
        profile.displayName(),
        profile.primaryContact(),
        profile.secondaryContact(),
        Timestamp.from(profile.joinedAt()),
        profile.totalTrades(),
        profile.completedTrades(),
        profile.disputedTrades(),
        profile.averageSettlementSeconds());
  }

  @Override
  public void update(Profile profile) {
    String sql =
        """
        UPDATE profiles
        SET primary_contact = ?,
            secondary_contact = ?,
            total_trades = ?,
            completed_trades = ?,
            disputed_trades = ?,
            average_settlement_seconds = ?
        WHERE principal = ?
        """;
    jdbcTemplate.update(
        sql,
        profile.primaryContact(),
        profile.secondaryContact(),
        profile.totalTrades(),
        profile.completedTrades(),
        profile.disputedTrades(),
        profile.averageSettlementSeconds(),
        profile.principal());
  }

  private Profile mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Profile(
        rs.getString("principal"),
        rs.getString("display_name"),
        rs.getString("primary_contact"),
        rs.getString("secondary_contact"),
        rs.getTimestamp("joined_at").toInstant(),
        rs.getLong("total_trades"),
        rs.getLong("completed_trades"),
        rs.getLong("disputed_trades"),
        rs.getLong("average_settlement_seconds"));
  }

  private static Optional<Profile> first(List<Profile> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
