package com.p2pescrow.escrowapi.offers;

import com.p2pescrow.domain.balance.InsufficientBalanceException;
import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.Offer;
import com.p2pescrow.escrowapi.balances.BalanceAccountingService;
import com.p2pescrow.escrowapi.profiles.ProfileService;
import java.math.BigInteger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OfferBookService {
  private static final Logger log = LoggerFactory.getLogger(OfferBookService.class);

  private final OfferRepository offerRepository;
  private final ProfileService profileService;
  private final BalanceAccountingService balanceAccountingService;

  public OfferBookService(
      OfferRepository offerRepository,
      ProfileService profileService,
      BalanceAccountingService balanceAccountingService) {
    this.offerRepository = offerRepository;
    this.profileService = profileService;
    this.balanceAccountingService = balanceAccountingService;
  }

  /**
   * Publishes a new offer. The seller must be able to cover {@code maxTradeAmount} right now, but
   * nothing is locked until a buyer opens an escrow, so several offers may share one deposit.
   */
  @Transactional
  public Offer createOffer(CreateOfferCommand command) {
    profileService.requireProfile(command.seller());
    Offer.validateTerms(
        command.maxTradeAmount(),
        command.minTradeAmount(),
        command.unitPrice(),
        command.currency(),
        command.paymentMethod());

    BigInteger available = balanceAccountingService.availableBalance(command.seller());
    if (available.compareTo(command.maxTradeAmount()) < 0) {
      throw new InsufficientBalanceException(
          command.seller(), command.maxTradeAmount(), available);
    }

    Offer offer =
        Offer.createNew(
            offerRepository.nextId(),
            command.seller(),
            command.maxTradeAmount(),
            command.minTradeAmount(),
            command.unitPrice(),
            command.currency(),
            command.paymentMethod(),
            command.occurredAt());
    offerRepository.insert(offer);
    log.info(
        "Offer created offerId={} seller={} min={} max={} currency={}",
        offer.id(),
        offer.seller(),
        offer.minTradeAmount(),
        offer.maxTradeAmount(),
        offer.currency());
    return offer;
  }

  @Transactional
  public Offer deactivateOffer(long offerId, String caller) {
    Offer current =
        offerRepository.findByIdForUpdate(offerId).orElseThrow(() -> notFound(offerId));
    Offer deactivated = current.deactivate(caller);
    offerRepository.update(deactivated);
    log.info("Offer deactivated offerId={} seller={}", offerId, caller);
    return deactivated;
  }

  /** Frees one open-escrow slot once an escrow against the offer reaches a final state. */
  @Transactional
  public Offer releaseEscrowSlot(long offerId) {
    Offer current =
        offerRepository.findByIdForUpdate(offerId).orElseThrow(() -> notFound(offerId));
    Offer updated = current.withEscrowClosed();
    offerRepository.update(updated);
    return updated;
  }

  @Transactional(readOnly = true)
  public Offer getOffer(long offerId) {
    return offerRepository.findById(offerId).orElseThrow(() -> notFound(offerId));
  }

  @Transactional(readOnly = true)
  public List<Offer> findOffersBySeller(String seller) {
    return offerRepository.findBySeller(seller);
  }

  @Transactional(readOnly = true)
  public List<Offer> findActiveOffers(int offset, int limit) {
    return offerRepository.findActive(offset, limit);
  }

  public static EscrowDomainException notFound(long offerId) {
    return new EscrowDomainException(
        EscrowErrorCode.OFFER_NOT_FOUND, "Offer not found: " + offerId);
  }
}
