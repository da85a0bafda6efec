package com.p2pescrow.escrowapi.support;

import com.p2pescrow.escrowapi.ledger.LedgerFailureReason;
import com.p2pescrow.escrowapi.ledger.LedgerTransferException;
import com.p2pescrow.escrowapi.ledger.SettlementLedger;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemorySettlementLedger implements SettlementLedger {
  public static final String CUSTODY = "escrow-custody";

  private final Map<String, BigInteger> accounts = new HashMap<>();

  public void credit(String principal, BigInteger amount) {
    accounts.merge(principal, amount, BigInteger::add);
  }

  @Override
  public void transferIn(String from, BigInteger amount) {
    BigInteger balance = balanceOf(from);
    if (balance.compareTo(amount) < 0) {
      throw new LedgerTransferException(LedgerFailureReason.INSUFFICIENT_FUNDS, from, amount);
    }
    accounts.put(from, balance.subtract(amount));
    credit(CUSTODY, amount);
  }

  @Override
  public void transferOut(String to, BigInteger amount) {
    BigInteger custody = balanceOf(CUSTODY);
    if (custody.compareTo(amount) < 0) {
      throw new LedgerTransferException(LedgerFailureReason.RESERVE_INSUFFICIENT, to, amount);
    }
    accounts.put(CUSTODY, custody.subtract(amount));
    credit(to, amount);
  }

  @Override
  public BigInteger balanceOf(String principal) {
    return accounts.getOrDefault(principal, BigInteger.ZERO);
  }
}
