package com.p2pescrow.escrowapi.escrows;

import static com.p2pescrow.escrowapi.support.EscrowAssertions.assertFailsWith;
import static com.p2pescrow.escrowapi.support.EscrowTestFixture.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.p2pescrow.domain.balance.InsufficientBalanceException;
import com.p2pescrow.domain.balance.SellerBalance;
import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.EscrowStatus;
import com.p2pescrow.domain.escrow.Offer;
import com.p2pescrow.domain.escrow.Profile;
import com.p2pescrow.escrowapi.support.EscrowTestFixture;
import com.p2pescrow.escrowapi.support.InMemorySettlementLedger;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EscrowEngineServiceTest {
  private EscrowTestFixture fixture;
  private EscrowEngineService engine;
  private Offer offer;

  @BeforeEach
  void setUp() {
    fixture = new EscrowTestFixture();
    engine = fixture.engine;
    offer = fixture.joeAndJohn();
  }

  @Test
  void shouldOpenEscrowAndLockSellerFunds() {
    Escrow escrow = fixture.open("john", offer.id(), 1000);

    assertEquals(1, escrow.id());
    assertEquals(EscrowStatus.PENDING, escrow.status());
    assertEquals("joe", escrow.seller());
    assertEquals(BigInteger.valueOf(8_000_000), escrow.fiatAmount());
    assertEquals(1, fixture.offers.getOffer(offer.id()).openEscrowCount());
    assertEquals(new SellerBalance("joe", amount(1000), amount(1000)), balance("joe"));
    assertEquals(1, profile("joe").totalTrades());
    assertEquals(1, profile("john").totalTrades());
  }

  @Test
  void shouldCompleteEscrowOnSellerConfirmation() {
    Escrow escrow = fixture.open("john", offer.id(), 1000);

    Escrow completed = engine.confirmPayment(escrow.id(), "joe", T0.plus(Duration.ofHours(2)));

    assertEquals(EscrowStatus.COMPLETED, completed.status());
    assertEquals(0, fixture.offers.getOffer(offer.id()).openEscrowCount());
    assertEquals(new SellerBalance("joe", BigInteger.ZERO, BigInteger.ZERO), balance("joe"));
    assertEquals(amount(1000), fixture.ledger.balanceOf("john"));
    assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(InMemorySettlementLedger.CUSTODY));
    assertEquals(1, profile("joe").completedTrades());
    assertEquals(7200, profile("joe").averageSettlementSeconds());
    assertEquals(0, profile("john").completedTrades());
  }

  @Test
  void shouldConserveValueAcrossConfirmation() {
    Escrow escrow = fixture.open("john", offer.id(), 400);
    BigInteger before =
        fixture.balances.depositedBalance("joe").add(fixture.ledger.balanceOf("john"));

    engine.confirmPayment(escrow.id(), "joe", T0.plusSeconds(60));

    BigInteger after =
        fixture.balances.depositedBalance("joe").add(fixture.ledger.balanceOf("john"));
    assertEquals(before, after);
    assertEquals(amount(600), fixture.balances.depositedBalance("joe"));
  }

  @Test
  void shouldFoldSettlementTimesIntoRunningAverage() {
    Escrow first = fixture.open("john", offer.id(), 100);
    Escrow second = fixture.open("john", offer.id(), 100);

    engine.confirmPayment(first.id(), "joe", T0.plusSeconds(7200));
    engine.confirmPayment(second.id(), "joe", T0.plusSeconds(3600));

    assertEquals(2, profile("joe").completedTrades());
    assertEquals(5400, profile("joe").averageSettlementSeconds());
  }

  @Test
  void shouldAllowConfirmationAtTheDeadlineAndRejectAfterIt() {
    Escrow late = fixture.open("john", offer.id(), 100);
    Escrow onTime = fixture.open("john", offer.id(), 100);
    Instant deadline = T0.plus(Duration.ofHours(48));

    assertFailsWith(
        EscrowErrorCode.ESCROW_TIMEOUT,
        () -> engine.confirmPayment(late.id(), "joe", deadline.plusSeconds(1)));
    assertEquals(EscrowStatus.PENDING, fixture.store.escrow(late.id()).orElseThrow().status());

    Escrow completed = engine.confirmPayment(onTime.id(), "joe", deadline);
    assertEquals(EscrowStatus.COMPLETED, completed.status());
  }

  @Test
  void shouldStillAllowBuyerToCancelAfterTimeout() {
    Escrow escrow = fixture.open("john", offer.id(), 100);

    Escrow cancelled = engine.cancelEscrow(escrow.id(), "john", T0.plus(Duration.ofDays(5)));

    assertEquals(EscrowStatus.CANCELLED, cancelled.status());
  }

  @Test
  void shouldOnlyLetSellerConfirm() {
    Escrow escrow = fixture.open("john", offer.id(), 100);

    assertFailsWith(
        EscrowErrorCode.UNAUTHORIZED, () -> engine.confirmPayment(escrow.id(), "john", T0));
  }

  @Test
  void shouldRejectConfirmationOfClosedEscrow() {
    Escrow escrow = fixture.open("john", offer.id(), 100);
    engine.cancelEscrow(escrow.id(), "john", T0);

    assertFailsWith(
        EscrowErrorCode.INVALID_STATE, () -> engine.confirmPayment(escrow.id(), "joe", T0));
  }

  @Test
  void shouldReportUnknownEscrow() {
    assertFailsWith(EscrowErrorCode.ESCROW_NOT_FOUND, () -> engine.confirmPayment(9, "joe", T0));
    assertFailsWith(EscrowErrorCode.ESCROW_NOT_FOUND, () -> engine.cancelEscrow(9, "john", T0));
    assertFailsWith(EscrowErrorCode.ESCROW_NOT_FOUND, () -> engine.raiseDispute(9, "john", T0));
    assertFailsWith(EscrowErrorCode.ESCROW_NOT_FOUND, () -> engine.getEscrow(9));
    assertFailsWith(EscrowErrorCode.ESCROW_NOT_FOUND, () -> engine.findEscrowEvents(9));
  }

  @Test
  void shouldMakeOpenThenCancelANoOpOnSellerBalance() {
    SellerBalance before = balance("joe");
    Escrow escrow = fixture.open("john", offer.id(), 700);

    engine.cancelEscrow(escrow.id(), "john", T0.plusSeconds(30));

    assertEquals(before, balance("joe"));
    assertEquals(0, fixture.offers.getOffer(offer.id()).openEscrowCount());
    assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf("john"));
  }

  @Test
  void shouldOnlyLetBuyerCancel() {
    Escrow escrow = fixture.open("john", offer.id(), 100);

    assertFailsWith(
        EscrowErrorCode.UNAUTHORIZED, () -> engine.cancelEscrow(escrow.id(), "joe", T0));
  }

  @Test
  void shouldLetEitherParticipantRaiseDispute() {
    Escrow first = fixture.open("john", offer.id(), 100);
    Escrow second = fixture.open("john", offer.id(), 100);

    assertEquals(EscrowStatus.DISPUTED, engine.raiseDispute(first.id(), "john", T0).status());
    assertEquals(EscrowStatus.DISPUTED, engine.raiseDispute(second.id(), "joe", T0).status());
    assertEquals(new SellerBalance("joe", amount(1000), amount(200)), balance("joe"));
    assertEquals(2, fixture.offers.getOffer(offer.id()).openEscrowCount());
  }

  @Test
  void shouldRejectDisputeFromOutsider() {
    fixture.register("mallory");
    Escrow escrow = fixture.open("john", offer.id(), 100);

    assertFailsWith(
        EscrowErrorCode.UNAUTHORIZED, () -> engine.raiseDispute(escrow.id(), "mallory", T0));
  }

  @Test
  void shouldRejectSecondDispute() {
    Escrow escrow = fixture.open("john", offer.id(), 100);
    engine.raiseDispute(escrow.id(), "john", T0);

    assertFailsWith(
        EscrowErrorCode.INVALID_STATE, () -> engine.raiseDispute(escrow.id(), "joe", T0));
    assertFailsWith(
        EscrowErrorCode.INVALID_STATE, () -> engine.cancelEscrow(escrow.id(), "john", T0));
  }

  @Test
  void shouldRejectSelfTradeWithoutChangingState() {
    Map<String, Object> before = fixture.store.snapshot();

    assertFailsWith(
        EscrowErrorCode.CANNOT_TRADE_WITH_SELF, () -> fixture.open("joe", offer.id(), 100));

    assertEquals(before, fixture.store.snapshot());
  }

  @Test
  void shouldRejectBuyerWithoutProfile() {
    assertFailsWith(
        EscrowErrorCode.PROFILE_REQUIRED, () -> fixture.open("stranger", offer.id(), 100));
  }

  @Test
  void shouldRejectUnknownOrInactiveOffer() {
    assertFailsWith(EscrowErrorCode.OFFER_NOT_FOUND, () -> fixture.open("john", 42, 100));

    fixture.offers.deactivateOffer(offer.id(), "joe");
    assertFailsWith(EscrowErrorCode.OFFER_INACTIVE, () -> fixture.open("john", offer.id(), 100));
  }

  @Test
  void shouldRejectAmountsOutsideOfferBounds() {
    Map<String, Object> before = fixture.store.snapshot();

    assertFailsWith(
        EscrowErrorCode.TRADE_AMOUNT_TOO_LOW, () -> fixture.open("john", offer.id(), 9));
    assertFailsWith(
        EscrowErrorCode.TRADE_AMOUNT_TOO_HIGH, () -> fixture.open("john", offer.id(), 1001));

    assertEquals(before, fixture.store.snapshot());
  }

  @Test
  void shouldRejectEscrowWhenSellerFundsAreAlreadyLocked() {
    fixture.open("john", offer.id(), 995);
    Map<String, Object> before = fixture.store.snapshot();

    InsufficientBalanceException ex =
        assertThrows(
            InsufficientBalanceException.class, () -> fixture.open("john", offer.id(), 10));

    assertEquals(amount(5), ex.available());
    assertEquals(before, fixture.store.snapshot());
  }

  @Test
  void shouldRejectEscrowBeyondOpenEscrowCap() {
    EscrowTestFixture capped = new EscrowTestFixture(2);
    Offer cappedOffer = capped.joeAndJohn();
    capped.open("john", cappedOffer.id(), 10);
    capped.open("john", cappedOffer.id(), 10);

    assertFailsWith(
        EscrowErrorCode.INVALID_STATE, () -> capped.open("john", cappedOffer.id(), 10));
    assertEquals(2, capped.offers.getOffer(cappedOffer.id()).openEscrowCount());
    assertEquals(amount(980), capped.balances.availableBalance("joe"));
  }

  @Test
  void shouldKeepOpenCountEqualToPendingAndDisputedEscrows() {
    Escrow confirmed = fixture.open("john", offer.id(), 100);
    Escrow cancelled = fixture.open("john", offer.id(), 100);
    Escrow disputed = fixture.open("john", offer.id(), 100);
    fixture.open("john", offer.id(), 100);

    engine.confirmPayment(confirmed.id(), "joe", T0);
    engine.cancelEscrow(cancelled.id(), "john", T0);
    engine.raiseDispute(disputed.id(), "john", T0);

    long open =
        engine.findEscrowsByPrincipal("joe").stream()
            .filter(escrow -> escrow.status().isOpen())
            .count();
    assertEquals(2, open);
    assertEquals(open, fixture.offers.getOffer(offer.id()).openEscrowCount());
    SellerBalance joe = balance("joe");
    assertTrue(joe.locked().compareTo(joe.deposited()) <= 0);
    assertEquals(amount(200), joe.locked());
    assertEquals(amount(900), joe.deposited());
  }

  @Test
  void shouldListEscrowsOfEachParticipantInOpeningOrder() {
    fixture.register("ann");
    Escrow first = fixture.open("john", offer.id(), 100);
    Escrow second = fixture.open("ann", offer.id(), 100);

    assertEquals(List.of(first, second), engine.findEscrowsByPrincipal("joe"));
    assertEquals(List.of(first), engine.findEscrowsByPrincipal("john"));
    assertEquals(List.of(second), engine.findEscrowsByPrincipal("ann"));
  }

  @Test
  void shouldRecordTransitionHistory() {
    Escrow escrow = fixture.open("john", offer.id(), 100);
    engine.raiseDispute(escrow.id(), "joe", T0.plusSeconds(10));

    List<EscrowEvent> events = engine.findEscrowEvents(escrow.id());

    assertEquals(2, events.size());
    assertEquals(EscrowEventRecorder.ESCROW_OPENED, events.get(0).eventType());
    assertNull(events.get(0).fromStatus());
    assertEquals("john", events.get(0).actor());
    assertEquals(EscrowEventRecorder.DISPUTE_RAISED, events.get(1).eventType());
    assertEquals(EscrowStatus.PENDING, events.get(1).fromStatus());
    assertEquals(EscrowStatus.DISPUTED, events.get(1).toStatus());
    assertTrue(events.get(0).payloadJson().contains("\"fiatAmount\":\"800000\""));
  }

  private SellerBalance balance(String principal) {
    return fixture.store.balanceOf(principal).orElseThrow();
  }

  private Profile profile(String principal) {
    return fixture.profiles.findProfile(principal).orElseThrow();
  }

  private static BigInteger amount(long value) {
    return BigInteger.valueOf(value);
  }
}
