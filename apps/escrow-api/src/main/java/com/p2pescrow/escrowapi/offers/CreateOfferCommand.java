package com.p2pescrow.escrowapi.offers;

import java.math.BigInteger;
import java.time.Instant;

public record CreateOfferCommand(
    String seller,
    BigInteger maxTradeAmount,
    BigInteger minTradeAmount,
    BigInteger unitPrice,
    String currency,
    String paymentMethod,
    Instant occurredAt) {}
