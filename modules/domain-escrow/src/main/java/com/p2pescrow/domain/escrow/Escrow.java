package com.p2pescrow.domain.escrow;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record Escrow(
    long id,
    long offerId,
    String buyer,
    String seller,
    BigInteger amount,
    BigInteger fiatAmount,
    Instant createdAt,
    EscrowStatus status) {

  /** Fixed-point scale of offer unit prices. */
  public static final BigInteger PRICE_PRECISION = BigInteger.TEN.pow(18);

  public Escrow {
    if (id <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "escrow id must be > 0");
    }
    if (offerId <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "offer id must be > 0");
    }
    DomainChecks.requirePrincipal(buyer, "buyer");
    DomainChecks.requirePrincipal(seller, "seller");
    DomainChecks.requirePositive(amount, "amount");
    Objects.requireNonNull(fiatAmount, "fiatAmount must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(status, "status must not be null");
  }

  public static Escrow open(long id, Offer offer, String buyer, BigInteger amount, Instant now) {
    Objects.requireNonNull(offer, "offer must not be null");
    return new Escrow(
        id,
        offer.id(),
        buyer,
        offer.seller(),
        amount,
        fiatAmount(amount, offer.unitPrice()),
        now,
        EscrowStatus.PENDING);
  }

  public static BigInteger fiatAmount(BigInteger amount, BigInteger unitPrice) {
    return amount.multiply(unitPrice).divide(PRICE_PRECISION);
  }

  public Escrow transitionTo(EscrowStatus toStatus) {
    EscrowStateMachine.validateTransition(status, toStatus);
    return new Escrow(id, offerId, buyer, seller, amount, fiatAmount, createdAt, toStatus);
  }

  public void requireStatus(EscrowStatus expected) {
    if (status != expected) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_STATE,
          "Escrow " + id + " is " + status + ", expected " + expected);
    }
  }

  public boolean isParticipant(String principal) {
    return buyer.equals(principal) || seller.equals(principal);
  }

  /** True once {@code now} is strictly past {@code createdAt + paymentWindow}. */
  public boolean isPaymentWindowExpired(Instant now, Duration paymentWindow) {
    return now.isAfter(createdAt.plus(paymentWindow));
  }

  public long secondsSinceCreation(Instant now) {
    return Math.max(0, Duration.between(createdAt, now).getSeconds());
  }
}
