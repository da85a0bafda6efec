package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record CreateOfferRequest(
    @NotNull BigInteger maxTradeAmount,
    @NotNull BigInteger minTradeAmount,
    @NotNull BigInteger unitPrice,
    @NotNull String currency,
    @NotNull String paymentMethod) {}
