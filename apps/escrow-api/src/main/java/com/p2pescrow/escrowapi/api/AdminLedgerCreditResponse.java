package com.p2pescrow.escrowapi.api;

import com.p2pescrow.escrowapi.ledger.LedgerCreditResult;
import java.math.BigInteger;

public record AdminLedgerCreditResponse(String principal, BigInteger credited, BigInteger balance) {
  public static AdminLedgerCreditResponse from(LedgerCreditResult result) {
    return new AdminLedgerCreditResponse(result.principal(), result.credited(), result.balance());
  }
}
