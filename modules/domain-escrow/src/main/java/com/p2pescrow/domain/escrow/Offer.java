package com.p2pescrow.domain.escrow;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * A seller's standing offer to sell the settlement asset at {@code unitPrice} for trades between
 * {@code minTradeAmount} and {@code maxTradeAmount}. Offers are deactivated, never deleted.
 */
public record Offer(
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

  public Offer {
    if (id <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "offer id must be > 0");
    }
    DomainChecks.requirePrincipal(seller, "seller");
    validateTerms(maxTradeAmount, minTradeAmount, unitPrice, currency, paymentMethod);
    if (openEscrowCount < 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_INPUT, "openEscrowCount must be >= 0");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public static Offer createNew(
      long id,
      String seller,
      BigInteger maxTradeAmount,
      BigInteger minTradeAmount,
      BigInteger unitPrice,
      String currency,
      String paymentMethod,
      Instant now) {
    return new Offer(
        id,
        seller,
        maxTradeAmount,
        minTradeAmount,
        unitPrice,
        currency,
        paymentMethod,
        0,
        true,
        now);
  }

  /**
   * Checks offer terms in a fixed order: missing or zero bounds and blank labels first
   * ({@code INVALID_INPUT}), then inconsistent bounds or a zero price ({@code
   * INVALID_PRICE_PARAMETERS}).
   */
  public static void validateTerms(
      BigInteger maxTradeAmount,
      BigInteger minTradeAmount,
      BigInteger unitPrice,
      String currency,
      String paymentMethod) {
    DomainChecks.requirePositive(maxTradeAmount, "maxTradeAmount");
    DomainChecks.requirePositive(minTradeAmount, "minTradeAmount");
    DomainChecks.requireNonBlank(currency, "currency");
    DomainChecks.requireNonBlank(paymentMethod, "paymentMethod");
    if (maxTradeAmount.compareTo(minTradeAmount) < 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_PRICE_PARAMETERS,
          "maxTradeAmount " + maxTradeAmount + " is below minTradeAmount " + minTradeAmount);
    }
    if (unitPrice == null || unitPrice.signum() <= 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_PRICE_PARAMETERS, "unitPrice must be > 0");
    }
  }

  public void requireActive() {
    if (!active) {
      throw new EscrowDomainException(
          EscrowErrorCode.OFFER_INACTIVE, "Offer " + id + " is inactive");
    }
  }

  public void requireTradeAmount(BigInteger amount) {
    if (amount == null || amount.compareTo(minTradeAmount) < 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.TRADE_AMOUNT_TOO_LOW,
          "Trade amount " + amount + " is below the offer minimum " + minTradeAmount);
    }
    if (amount.compareTo(maxTradeAmount) > 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.TRADE_AMOUNT_TOO_HIGH,
          "Trade amount " + amount + " is above the offer maximum " + maxTradeAmount);
    }
  }

  public Offer withEscrowOpened(int maxOpenEscrows) {
    if (openEscrowCount >= maxOpenEscrows) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_STATE,
          "Offer " + id + " already has " + openEscrowCount + " open escrows");
    }
    return withOpenEscrowCount(openEscrowCount + 1);
  }

  public Offer withEscrowClosed() {
    if (openEscrowCount == 0) {
      throw new IllegalStateException("Offer " + id + " has no open escrows to close");
    }
    return withOpenEscrowCount(openEscrowCount - 1);
  }

  public Offer deactivate(String caller) {
    requireActive();
    if (!seller.equals(caller)) {
      throw new EscrowDomainException(
          EscrowErrorCode.UNAUTHORIZED, "Only the seller may deactivate offer " + id);
    }
    if (openEscrowCount > 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.ACTIVE_ESCROWS_EXIST,
          "Offer " + id + " still has " + openEscrowCount + " open escrows");
    }
    return new Offer(
        id,
        seller,
        maxTradeAmount,
        minTradeAmount,
        unitPrice,
        currency,
        paymentMethod,
        openEscrowCount,
        false,
        createdAt);
  }

  private Offer withOpenEscrowCount(int nextOpenEscrowCount) {
    return new Offer(
        id,
        seller,
        maxTradeAmount,
        minTradeAmount,
        unitPrice,
        currency,
        paymentMethod,
        nextOpenEscrowCount,
        active,
        createdAt);
  }
}
