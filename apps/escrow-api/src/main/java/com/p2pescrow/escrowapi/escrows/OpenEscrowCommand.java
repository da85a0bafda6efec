package com.p2pescrow.escrowapi.escrows;

import java.math.BigInteger;
import java.time.Instant;

public record OpenEscrowCommand(
    String buyer, long offerId, BigInteger amount, Instant occurredAt) {}
