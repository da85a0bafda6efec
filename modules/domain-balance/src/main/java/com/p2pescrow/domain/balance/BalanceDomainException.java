package com.p2pescrow.domain.balance;

public class BalanceDomainException extends RuntimeException {
  public BalanceDomainException(String message) {
    super(message);
  }
}
