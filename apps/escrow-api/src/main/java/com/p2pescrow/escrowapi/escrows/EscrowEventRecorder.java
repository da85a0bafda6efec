package com.p2pescrow.escrowapi.escrows;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.domain.escrow.EscrowStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Appends one history row per escrow transition, in the caller's transaction. */
@Component
public class EscrowEventRecorder {
  public static final String ESCROW_OPENED = "ESCROW_OPENED";
  public static final String PAYMENT_CONFIRMED = "PAYMENT_CONFIRMED";
  public static final String ESCROW_CANCELLED = "ESCROW_CANCELLED";
  public static final String DISPUTE_RAISED = "DISPUTE_RAISED";
  public static final String DISPUTE_RESOLVED = "DISPUTE_RESOLVED";

  private final EscrowEventRepository escrowEventRepository;
  private final ObjectMapper objectMapper;

  public EscrowEventRecorder(
      EscrowEventRepository escrowEventRepository, ObjectMapper objectMapper) {
    this.escrowEventRepository = escrowEventRepository;
    this.objectMapper = objectMapper;
  }

  public void record(
      String eventType,
      Escrow escrow,
      EscrowStatus fromStatus,
      String actor,
      Instant occurredAt,
      Map<String, Object> details) {
    Map<String, Object> payload = snapshot(escrow);
    payload.putAll(details);
    escrowEventRepository.append(
        new EscrowEventAppend(
            escrow.id(),
            eventType,
            fromStatus,
            escrow.status(),
            actor,
            toJson(payload),
            occurredAt));
  }

  private static Map<String, Object> snapshot(Escrow escrow) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("escrowId", escrow.id());
    payload.put("offerId", escrow.offerId());
    payload.put("buyer", escrow.buyer());
    payload.put("seller", escrow.seller());
    payload.put("amount", escrow.amount().toString());
    payload.put("fiatAmount", escrow.fiatAmount().toString());
    payload.put("status", escrow.status());
    return payload;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize escrow event payload", ex);
    }
  }
}
