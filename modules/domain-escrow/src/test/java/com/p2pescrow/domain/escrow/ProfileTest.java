package com.p2pescrow.domain.escrow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class ProfileTest {
  private static final Instant NOW = Instant.parse("2026-02-24T00:00:00Z");

  @Test
  void shouldStartWithZeroedCounters() {
    Profile profile = Profile.createNew("joe", "Joe", "@joe", "joe@example.com", NOW);

    assertEquals(0, profile.totalTrades());
    assertEquals(0, profile.completedTrades());
    assertEquals(0, profile.disputedTrades());
    assertEquals(0, profile.averageSettlementSeconds());
    assertEquals(NOW, profile.joinedAt());
  }

  @Test
  void shouldRejectBlankFields() {
    EscrowDomainException ex =
        assertThrows(
            EscrowDomainException.class,
            () -> Profile.createNew("joe", "", "@joe", "joe@example.com", NOW));
    assertEquals(EscrowErrorCode.INVALID_INPUT, ex.code());

    EscrowDomainException address =
        assertThrows(
            EscrowDomainException.class,
            () -> Profile.createNew(" ", "Joe", "@joe", "joe@example.com", NOW));
    assertEquals(EscrowErrorCode.INVALID_ADDRESS, address.code());
  }

  @Test
  void shouldAverageSettlementTimeWithIntegerArithmetic() {
    Profile profile = Profile.createNew("joe", "Joe", "@joe", "joe@example.com", NOW);

    Profile first = profile.withSettledTrade(100);
    assertEquals(1, first.completedTrades());
    assertEquals(100, first.averageSettlementSeconds());

    Profile second = first.withSettledTrade(51);
    assertEquals(2, second.completedTrades());
    assertEquals(75, second.averageSettlementSeconds());
  }

  @Test
  void shouldCountCompletionWithoutChangingAverage() {
    Profile profile =
        Profile.createNew("joe", "Joe", "@joe", "joe@example.com", NOW).withSettledTrade(40);

    Profile resolved = profile.withCompletedTrade().withDisputedTrade();

    assertEquals(2, resolved.completedTrades());
    assertEquals(1, resolved.disputedTrades());
    assertEquals(40, resolved.averageSettlementSeconds());
  }

  @Test
  void shouldOnlyChangeContacts() {
    Profile profile =
        Profile.createNew("joe", "Joe", "@joe", "joe@example.com", NOW).withTradeOpened();

    Profile updated = profile.withContacts("@joe2", "joe2@example.com");

    assertEquals("Joe", updated.displayName());
    assertEquals("@joe2", updated.primaryContact());
    assertEquals("joe2@example.com", updated.secondaryContact());
    assertEquals(1, updated.totalTrades());
  }
}
