package com.p2pescrow.escrowapi.profiles;

import static com.p2pescrow.escrowapi.support.EscrowAssertions.assertFailsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.Profile;
import com.p2pescrow.escrowapi.support.InMemoryEscrowStore;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

class ProfileServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private InMemoryEscrowStore store;
  private ProfileService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryEscrowStore();
    service = new ProfileService(store);
  }

  @Test
  void shouldCreateProfileWithZeroedCounters() {
    Profile profile = service.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW);

    assertEquals("joe", profile.principal());
    assertEquals(NOW, profile.joinedAt());
    assertEquals(0, profile.totalTrades());
    assertEquals(0, profile.completedTrades());
    assertEquals(0, profile.disputedTrades());
    assertEquals(0, profile.averageSettlementSeconds());
    assertTrue(service.findProfile("joe").isPresent());
  }

  @Test
  void shouldRejectDuplicateProfile() {
    service.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW);

    assertFailsWith(
        EscrowErrorCode.ALREADY_EXISTS,
        () -> service.createProfile("joe", "Joseph", "other@mail", "+2348001", NOW));
    assertEquals("Joe", service.findProfile("joe").orElseThrow().displayName());
  }

  @Test
  void shouldReportConcurrentDuplicateInsertAsAlreadyExists() {
    ProfileRepository repository = mock(ProfileRepository.class);
    when(repository.exists("joe")).thenReturn(false);
    doThrow(new DuplicateKeyException("profiles_pkey")).when(repository).insert(any());
    ProfileService racing = new ProfileService(repository);

    assertFailsWith(
        EscrowErrorCode.ALREADY_EXISTS,
        () -> racing.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW));
  }

  @Test
  void shouldRejectEmptyStringsWithoutStoringProfile() {
    assertFailsWith(
        EscrowErrorCode.INVALID_INPUT,
        () -> service.createProfile("joe", "", "joe@mail", "+2348000", NOW));
    assertFailsWith(
        EscrowErrorCode.INVALID_INPUT,
        () -> service.createProfile("joe", "Joe", "", "+2348000", NOW));
    assertFailsWith(
        EscrowErrorCode.INVALID_INPUT,
        () -> service.createProfile("joe", "Joe", "joe@mail", " ", NOW));

    assertFalse(service.findProfile("joe").isPresent());
  }

  @Test
  void shouldRejectBlankPrincipalAsInvalidAddress() {
    assertFailsWith(
        EscrowErrorCode.INVALID_ADDRESS,
        () -> service.createProfile(" ", "Joe", "joe@mail", "+2348000", NOW));
  }

  @Test
  void shouldUpdateOnlyContactFields() {
    service.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW);

    Profile updated = service.updateProfile("joe", "joe@new", "+2349999");

    assertEquals("Joe", updated.displayName());
    assertEquals("joe@new", updated.primaryContact());
    assertEquals("+2349999", updated.secondaryContact());
    assertEquals(NOW, updated.joinedAt());
    assertEquals(updated, service.findProfile("joe").orElseThrow());
  }

  @Test
  void shouldRequireProfileForUpdate() {
    assertFailsWith(
        EscrowErrorCode.PROFILE_REQUIRED, () -> service.updateProfile("ghost", "a", "b"));
  }

  @Test
  void shouldRejectBlankContactOnUpdateAndKeepOriginal() {
    Profile created = service.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW);

    assertFailsWith(EscrowErrorCode.INVALID_INPUT, () -> service.updateProfile("joe", "", "x"));
    assertEquals(created, service.findProfile("joe").orElseThrow());
  }

  @Test
  void shouldApplyTradeCountersToEachProfile() {
    service.createProfile("joe", "Joe", "joe@mail", "+2348000", NOW);
    service.createProfile("john", "John", "john@mail", "+2348001", NOW);

    service.recordTrades(
        Map.of("john", Profile::withDisputedTrade, "joe", Profile::withCompletedTrade));

    assertEquals(1, service.findProfile("joe").orElseThrow().completedTrades());
    assertEquals(1, service.findProfile("john").orElseThrow().disputedTrades());
  }

  @Test
  void shouldRejectProfileCheckForUnknownPrincipal() {
    assertFailsWith(EscrowErrorCode.PROFILE_REQUIRED, () -> service.requireProfile("ghost"));
  }
}
