package com.p2pescrow.domain.escrow;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity and reputation record of a trading principal. Profiles are created once and never
 * deleted; only the contact fields and the trade counters change afterwards.
 */
public record Profile(
    String principal,
    String displayName,
    String primaryContact,
    String secondaryContact,
    Instant joinedAt,
    long totalTrades,
    long completedTrades,
    long disputedTrades,
    long averageSettlementSeconds) {

  public Profile {
    DomainChecks.requirePrincipal(principal, "principal");
    DomainChecks.requireNonBlank(displayName, "displayName");
    DomainChecks.requireNonBlank(primaryContact, "primaryContact");
    DomainChecks.requireNonBlank(secondaryContact, "secondaryContact");
    Objects.requireNonNull(joinedAt, "joinedAt must not be null");
    if (totalTrades < 0 || completedTrades < 0 || disputedTrades < 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "trade counters must be >= 0");
    }
    if (averageSettlementSeconds < 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_INPUT, "averageSettlementSeconds must be >= 0");
    }
  }

  public static Profile createNew(
      String principal,
      String displayName,
      String primaryContact,
      String secondaryContact,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new Profile(principal, displayName, primaryContact, secondaryContact, now, 0, 0, 0, 0);
  }

  public Profile withContacts(String nextPrimaryContact, String nextSecondaryContact) {
    return new Profile(
        principal,
        displayName,
        nextPrimaryContact,
        nextSecondaryContact,
        joinedAt,
        totalTrades,
        completedTrades,
        disputedTrades,
        averageSettlementSeconds);
  }

  public Profile withTradeOpened() {
    return new Profile(
        principal,
        displayName,
        primaryContact,
        secondaryContact,
        joinedAt,
        totalTrades + 1,
        completedTrades,
        disputedTrades,
        averageSettlementSeconds);
  }

  /**
   * Counts a completed trade and folds its settlement time into the running average using
   * integer arithmetic: {@code (avg * (n - 1) + elapsed) / n}.
   */
  public Profile withSettledTrade(long elapsedSeconds) {
    if (elapsedSeconds < 0) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_INPUT, "elapsedSeconds must be >= 0");
    }
    long completed = completedTrades + 1;
    long average = (averageSettlementSeconds * (completed - 1) + elapsedSeconds) / completed;
    return new Profile(
        principal,
        displayName,
        primaryContact,
        secondaryContact,
        joinedAt,
        totalTrades,
        completed,
        disputedTrades,
        average);
  }

  /** Counts a completed trade without touching the settlement-time average. */
  public Profile withCompletedTrade() {
    return new Profile(
        principal,
        displayName,
        primaryContact,
        secondaryContact,
        joinedAt,
        totalTrades,
        completedTrades + 1,
        disputedTrades,
        averageSettlementSeconds);
  }

  public Profile withDisputedTrade() {
    return new Profile(
        principal,
        displayName,
        primaryContact,
        secondaryContact,
        joinedAt,
        totalTrades,
        completedTrades,
        disputedTrades + 1,
        averageSettlementSeconds);
  }
}
