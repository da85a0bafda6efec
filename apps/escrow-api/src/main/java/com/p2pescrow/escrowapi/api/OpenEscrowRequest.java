package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record OpenEscrowRequest(@NotNull Long offerId, @NotNull BigInteger amount) {}
