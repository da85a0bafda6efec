package com.p2pescrow.escrowapi.api;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.p2pescrow.escrowapi.escrows.EscrowEvent;
import java.time.Instant;
import java.util.UUID;

public record EscrowEventResponse(
    UUID id,
    String eventType,
    String fromStatus,
    String toStatus,
    String actor,
    @JsonRawValue String payload,
    Instant occurredAt) {

  public static EscrowEventResponse from(EscrowEvent event) {
    return new EscrowEventResponse(
        event.id(),
        event.eventType(),
        event.fromStatus() == null ? null : event.fromStatus().name(),
        event.toStatus().name(),
        event.actor(),
        event.payloadJson(),
        event.occurredAt());
  }
}
