package com.p2pescrow.domain.balance;

import java.math.BigInteger;

public class InsufficientBalanceException extends BalanceDomainException {
  private final String principal;
  private final BigInteger requested;
  private final BigInteger available;

  public InsufficientBalanceException(
      String principal, BigInteger requested, BigInteger available) {
    super(
        String.format(
            "Insufficient balance for %s: requested=%s, available=%s",
            principal, requested, available));
    this.principal = principal;
    this.requested = requested;
    this.available = available;
  }

  public String principal() {
    return principal;
  }

  public BigInteger requested() {
    return requested;
  }

  public BigInteger available() {
    return available;
  }
}
