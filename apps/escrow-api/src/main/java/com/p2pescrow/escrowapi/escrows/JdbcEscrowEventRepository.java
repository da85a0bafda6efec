package com.p2pescrow.escrowapi.escrows;

import com.p2pescrow.domain.escrow.EscrowStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcEscrowEventRepository implements EscrowEventRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcEscrowEventRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void append(EscrowEventAppend event) {
    String sql =
        """
        INSERT INTO escrow_events (
            id,
            escrow_id,
            event_type,
            from_status,
            to_status,
            actor,
            payload,
            created_at
        ) VALUES (?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?)
        """;
    jdbcTemplate.update(
        sql,
        UUID.randomUUID(),
        event.escrowId(),
        event.eventType(),
        event.fromStatus() == null ? null : event.fromStatus().name(),
        event.toStatus().name(),
        event.actor(),
        event.payloadJson(),
        Timestamp.from(event.occurredAt()));
  }

  @Override
  public List<EscrowEvent> findByEscrowId(long escrowId) {
    String sql =
        """
        SELECT id, escrow_id, event_type, from_status, to_status, actor, payload, created_at
        FROM escrow_events
        WHERE escrow_id = ?
        ORDER BY sequence_no ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow, escrowId);
  }

  private EscrowEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
    String fromStatus = rs.getString("from_status");
    return new EscrowEvent(
        rs.getObject("id", UUID.class),
        rs.getLong("escrow_id"),
        rs.getString("event_type"),
        fromStatus == null ? null : EscrowStatus.valueOf(fromStatus),
        EscrowStatus.valueOf(rs.getString("to_status")),
        rs.getString("actor"),
        rs.getString("payload"),
        rs.getTimestamp("created_at").toInstant());
  }
}
