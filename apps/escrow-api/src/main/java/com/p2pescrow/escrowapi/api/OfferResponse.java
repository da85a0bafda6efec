package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Offer;
import java.math.BigInteger;
import java.time.Instant;

public record OfferResponse(
    long id,
    String seller,
    BigInteger maxTradeAmount,
    BigInteger minTradeAmount,
    BigInteger unitPrice,
    String currency,
    String paymentMethod,
    int openEscrowCount,
    boolean active,
    Instant createdAt) {

  public static OfferResponse from(Offer offer) {
    return new OfferResponse(
        offer.id(),
        offer.seller(),
        offer.maxTradeAmount(),
        offer.minTradeAmount(),
        offer.unitPrice(),
        offer.currency(),
        offer.paymentMethod(),
        offer.openEscrowCount(),
        offer.active(),
        offer.createdAt());
  }
}
