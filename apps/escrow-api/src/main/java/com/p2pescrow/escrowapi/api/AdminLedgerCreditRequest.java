package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record AdminLedgerCreditRequest(@NotNull String principal, @NotNull BigInteger amount) {}
