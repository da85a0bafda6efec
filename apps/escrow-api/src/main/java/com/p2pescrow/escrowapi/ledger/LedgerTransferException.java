package com.p2pescrow.escrowapi.ledger;

import java.math.BigInteger;

public class LedgerTransferException extends RuntimeException {
  private final LedgerFailureReason reason;
  private final String principal;
  private final BigInteger amount;

  public LedgerTransferException(
      LedgerFailureReason reason, String principal, BigInteger amount) {
    super(
        String.format(
            "Settlement transfer of %s for %s rejected: %s", amount, principal, reason));
    this.reason = reason;
    this.principal = principal;
    this.amount = amount;
  }

  public LedgerFailureReason reason() {
    return reason;
  }

  public String principal() {
    return principal;
  }

  public BigInteger amount() {
    return amount;
  }
}
