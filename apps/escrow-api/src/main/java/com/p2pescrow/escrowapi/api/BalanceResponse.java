package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.balance.SellerBalance;
import java.math.BigInteger;

/** Custody position of a principal plus the balance it holds outside custody. */
public record BalanceResponse(
    String principal, BigInteger deposited, BigInteger available, BigInteger externalBalance) {

  public static BalanceResponse from(SellerBalance balance, BigInteger externalBalance) {
    return new BalanceResponse(
        balance.principal(), balance.deposited(), balance.available(), externalBalance);
  }
}
