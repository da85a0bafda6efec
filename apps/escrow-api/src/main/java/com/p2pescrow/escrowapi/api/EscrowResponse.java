package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Escrow;
import java.math.BigInteger;
import java.time.Instant;

public record EscrowResponse(
    long id,
    long offerId,
    String buyer,
    String seller,
    BigInteger amount,
    BigInteger fiatAmount,
    String status,
    Instant createdAt) {

  public static EscrowResponse from(Escrow escrow) {
    return new EscrowResponse(
        escrow.id(),
        escrow.offerId(),
        escrow.buyer(),
        escrow.seller(),
        escrow.amount(),
        escrow.fiatAmount(),
        escrow.status().name(),
        escrow.createdAt());
  }
}
