package com.p2pescrow.escrowapi.escrows;

import com.p2pescrow.domain.escrow.EscrowStatus;
import java.time.Instant;

public record EscrowEventAppend(
    long escrowId,
    String eventType,
    EscrowStatus fromStatus,
    EscrowStatus toStatus,
    String actor,
    String payloadJson,
    Instant occurredAt) {}
