package com.p2pescrow.escrowapi.escrows;

import com.p2pescrow.domain.balance.InsufficientBalanceException;
import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.EscrowStatus;
import com.p2pescrow.domain.escrow.Offer;
import com.p2pescrow.domain.escrow.Profile;
import com.p2pescrow.escrowapi.balances.BalanceAccountingService;
import com.p2pescrow.escrowapi.config.EscrowEngineProperties;
import com.p2pescrow.escrowapi.ledger.SettlementLedger;
import com.p2pescrow.escrowapi.offers.OfferBookService;
import com.p2pescrow.escrowapi.offers.OfferRepository;
import com.p2pescrow.escrowapi.profiles.ProfileService;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drives the escrow lifecycle. Every transition validates everything it can before the first
 * write, then locks rows in the order escrow, offer, balance, profiles. Ledger transfers run last
 * so that a rejected transfer rolls the whole transition back.
 */
@Service
public class EscrowEngineService {
  private static final Logger log = LoggerFactory.getLogger(EscrowEngineService.class);

  private final EscrowRepository escrowRepository;
  private final OfferRepository offerRepository;
  private final OfferBookService offerBookService;
  private final ProfileService profileService;
  private final BalanceAccountingService balanceAccountingService;
  private final SettlementLedger settlementLedger;
  private final EscrowEventRecorder eventRecorder;
  private final EscrowEventRepository escrowEventRepository;
  private final Duration paymentTimeout;
  private final int maxOpenEscrowsPerOffer;

  public EscrowEngineService(
      EscrowRepository escrowRepository,
      OfferRepository offerRepository,
      OfferBookService offerBookService,
      ProfileService profileService,
      BalanceAccountingService balanceAccountingService,
      SettlementLedger settlementLedger,
      EscrowEventRecorder eventRecorder,
      EscrowEventRepository escrowEventRepository,
      EscrowEngineProperties properties) {
    this.escrowRepository = escrowRepository;
    this.offerRepository = offerRepository;
    this.offerBookService = offerBookService;
    this.profileService = profileService;
    this.balanceAccountingService = balanceAccountingService;
    this.settlementLedger = settlementLedger;
    this.eventRecorder = eventRecorder;
    this.escrowEventRepository = escrowEventRepository;
    this.paymentTimeout = properties.getPaymentTimeout();
    this.maxOpenEscrowsPerOffer = properties.getMaxOpenEscrowsPerOffer();
  }

  @Transactional
  public Escrow openEscrow(OpenEscrowCommand command) {
    String buyer = command.buyer();
    profileService.requireProfile(buyer);
    Offer offer =
        offerRepository
            .findByIdForUpdate(command.offerId())
            .orElseThrow(() -> OfferBookService.notFound(command.offerId()));
    offer.requireActive();
    if (offer.seller().equals(buyer)) {
      throw new EscrowDomainException(
          EscrowErrorCode.CANNOT_TRADE_WITH_SELF,
          "Buyer " + buyer + " is the seller of offer " + offer.id());
    }
    offer.requireTradeAmount(command.amount());
    BigInteger available = balanceAccountingService.availableBalance(offer.seller());
    if (available.compareTo(command.amount()) < 0) {
      throw new InsufficientBalanceException(offer.seller(), command.amount(), available);
    }
    Offer updatedOffer = offer.withEscrowOpened(maxOpenEscrowsPerOffer);

    offerRepository.update(updatedOffer);
    balanceAccountingService.lock(offer.seller(), command.amount());
    Escrow escrow =
        Escrow.open(
            escrowRepository.nextId(), offer, buyer, command.amount(), command.occurredAt());
    escrowRepository.insert(escrow);
    profileService.recordTrades(
        Map.of(buyer, Profile::withTradeOpened, offer.seller(), Profile::withTradeOpened));
    eventRecorder.record(
        EscrowEventRecorder.ESCROW_OPENED,
        escrow,
        null,
        buyer,
        command.occurredAt(),
        Map.of("unitPrice", offer.unitPrice().toString(), "currency", offer.currency()));
    log.info(
        "Escrow opened escrowId={} offerId={} buyer={} seller={} amount={} fiatAmount={}",
        escrow.id(),
        escrow.offerId(),
        escrow.buyer(),
        escrow.seller(),
        escrow.amount(),
        escrow.fiatAmount());
    return escrow;
  }

  /**
   * Seller acknowledges the off-platform payment. The escrowed amount leaves custody to the
   * buyer and the seller's settlement-time average absorbs the elapsed time.
   */
  @Transactional
  public Escrow confirmPayment(long escrowId, String caller, Instant now) {
    Escrow escrow = lockEscrow(escrowId);
    escrow.requireStatus(EscrowStatus.PENDING);
    if (!escrow.seller().equals(caller)) {
      throw unauthorized("Only the seller may confirm payment for escrow " + escrowId);
    }
    if (escrow.isPaymentWindowExpired(now, paymentTimeout)) {
      throw new EscrowDomainException(
          EscrowErrorCode.ESCROW_TIMEOUT,
          "Payment window for escrow " + escrowId + " closed at "
              + escrow.createdAt().plus(paymentTimeout));
    }
    long elapsedSeconds = escrow.secondsSinceCreation(now);

    Escrow completed = escrow.transitionTo(EscrowStatus.COMPLETED);
    escrowRepository.update(completed);
    offerBookService.releaseEscrowSlot(escrow.offerId());
    balanceAccountingService.settle(escrow.seller(), escrow.amount());
    profileService.recordTrades(
        Map.of(escrow.seller(), profile -> profile.withSettledTrade(elapsedSeconds)));
    settlementLedger.transferOut(escrow.buyer(), escrow.amount());
    eventRecorder.record(
        EscrowEventRecorder.PAYMENT_CONFIRMED,
        completed,
        escrow.status(),
        caller,
        now,
        Map.of("settlementSeconds", elapsedSeconds));
    log.info(
        "Escrow completed escrowId={} seller={} buyer={} amount={} settlementSeconds={}",
        escrowId,
        escrow.seller(),
        escrow.buyer(),
        escrow.amount(),
        elapsedSeconds);
    return completed;
  }

  @Transactional
  public Escrow cancelEscrow(long escrowId, String caller, Instant now) {
    Escrow escrow = lockEscrow(escrowId);
    escrow.requireStatus(EscrowStatus.PENDING);
    if (!escrow.buyer().equals(caller)) {
      throw unauthorized("Only the buyer may cancel escrow " + escrowId);
    }

    Escrow cancelled = escrow.transitionTo(EscrowStatus.CANCELLED);
    escrowRepository.update(cancelled);
    offerBookService.releaseEscrowSlot(escrow.offerId());
    balanceAccountingService.unlock(escrow.seller(), escrow.amount());
    eventRecorder.record(
        EscrowEventRecorder.ESCROW_CANCELLED, cancelled, escrow.status(), caller, now, Map.of());
    log.info(
        "Escrow cancelled escrowId={} buyer={} seller={} amount={}",
        escrowId,
        escrow.buyer(),
        escrow.seller(),
        escrow.amount());
    return cancelled;
  }

  @Transactional
  public Escrow raiseDispute(long escrowId, String caller, Instant now) {
    Escrow escrow = lockEscrow(escrowId);
    escrow.requireStatus(EscrowStatus.PENDING);
    if (!escrow.isParticipant(caller)) {
      throw unauthorized("Only a participant may dispute escrow " + escrowId);
    }

    Escrow disputed = escrow.transitionTo(EscrowStatus.DISPUTED);
    escrowRepository.update(disputed);
    eventRecorder.record(
        EscrowEventRecorder.DISPUTE_RAISED, disputed, escrow.status(), caller, now, Map.of());
    log.info("Escrow disputed escrowId={} raisedBy={}", escrowId, caller);
    return disputed;
  }

  @Transactional(readOnly = true)
  public Escrow getEscrow(long escrowId) {
    return escrowRepository.findById(escrowId).orElseThrow(() -> notFound(escrowId));
  }

  @Transactional(readOnly = true)
  public List<Escrow> findEscrowsByPrincipal(String principal) {
    return escrowRepository.findByParticipant(principal);
  }

  @Transactional(readOnly = true)
  public List<EscrowEvent> findEscrowEvents(long escrowId) {
    if (escrowRepository.findById(escrowId).isEmpty()) {
      throw notFound(escrowId);
    }
    return escrowEventRepository.findByEscrowId(escrowId);
  }

  private Escrow lockEscrow(long escrowId) {
    return escrowRepository.findByIdForUpdate(escrowId).orElseThrow(() -> notFound(escrowId));
  }

  private static EscrowDomainException unauthorized(String message) {
    return new EscrowDomainException(EscrowErrorCode.UNAUTHORIZED, message);
  }

  public static EscrowDomainException notFound(long escrowId) {
    return new EscrowDomainException(
        EscrowErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId);
  }
}
