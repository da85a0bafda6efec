package com.p2pescrow.escrowapi.disputes;

/** Decides who may resolve disputed escrows. */
public interface ArbitratorPolicy {
  boolean isArbitrator(String principal);
}
