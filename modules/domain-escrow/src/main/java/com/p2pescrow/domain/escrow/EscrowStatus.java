package com.p2pescrow.domain.escrow;

public enum EscrowStatus {
  PENDING,
  COMPLETED,
  CANCELLED,
  DISPUTED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /** Escrows in these states still hold a lock on the seller's balance. */
  public boolean isOpen() {
    return this == PENDING || this == DISPUTED;
  }
}
