package com.p2pescrow.escrowapi.ledger;

import java.math.BigInteger;

/**
 * Moves settlement-asset value between an external principal and the escrow custody account.
 * Implementations raise {@link LedgerTransferException} when a transfer cannot be honoured.
 */
public interface SettlementLedger {
  void transferIn(String from, BigInteger amount);

  void transferOut(String to, BigInteger amount);

  BigInteger balanceOf(String principal);
}
