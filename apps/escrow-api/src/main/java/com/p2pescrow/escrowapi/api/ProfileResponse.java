package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Profile;
import java.time.Instant;

public record ProfileResponse(
    String principal,
    String displayName,
    String primaryContact,
    String secondaryContact,
    Instant joinedAt,
    long totalTrades,
    long completedTrades,
    long disputedTrades,
    long averageSettlementSeconds) {

  public static ProfileResponse from(Profile profile) {
    return new ProfileResponse(
        profile.principal(),
        profile.displayName(),
        profile.primaryContact(),
        profile.secondaryContact(),
        profile.joinedAt(),
        profile.totalTrades(),
        profile.completedTrades(),
        profile.disputedTrades(),
        profile.averageSettlementSeconds());
  }
}
