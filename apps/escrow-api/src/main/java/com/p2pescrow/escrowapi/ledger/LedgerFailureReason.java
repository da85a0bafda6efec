package com.p2pescrow.escrowapi.ledger;

public enum LedgerFailureReason {
  INSUFFICIENT_FUNDS,
  RESERVE_INSUFFICIENT
}
