package com.p2pescrow.escrowapi.ledger;

import java.math.BigInteger;

public record LedgerCreditResult(String principal, BigInteger credited, BigInteger balance) {}
