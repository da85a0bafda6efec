package com.p2pescrow.escrowapi.disputes;

import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.EscrowStatus;
import com.p2pescrow.domain.escrow.Profile;
import com.p2pescrow.escrowapi.balances.BalanceAccountingService;
import com.p2pescrow.escrowapi.escrows.EscrowEngineService;
import com.p2pescrow.escrowapi.escrows.EscrowEventRecorder;
import com.p2pescrow.escrowapi.escrows.EscrowRepository;
import com.p2pescrow.escrowapi.ledger.SettlementLedger;
import com.p2pescrow.escrowapi.offers.OfferBookService;
import com.p2pescrow.escrowapi.profiles.ProfileService;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DisputeResolutionService {
  private static final Logger log = LoggerFactory.getLogger(DisputeResolutionService.class);

  private final ArbitratorPolicy arbitratorPolicy;
  private final EscrowRepository escrowRepository;
  private final OfferBookService offerBookService;
  private final BalanceAccountingService balanceAccountingService;
  private final ProfileService profileService;
  private final SettlementLedger settlementLedger;
  private final EscrowEventRecorder eventRecorder;

  public DisputeResolutionService(
      ArbitratorPolicy arbitratorPolicy,
      EscrowRepository escrowRepository,
      OfferBookService offerBookService,
      BalanceAccountingService balanceAccountingService,
      ProfileService profileService,
      SettlementLedger settlementLedger,
      EscrowEventRecorder eventRecorder) {
    this.arbitratorPolicy = arbitratorPolicy;
    this.escrowRepository = escrowRepository;
    this.offerBookService = offerBookService;
    this.balanceAccountingService = balanceAccountingService;
    this.profileService = profileService;
    this.settlementLedger = settlementLedger;
    this.eventRecorder = eventRecorder;
  }

  /**
   * Closes a disputed escrow. In the buyer's favour the locked amount leaves custody to the
   * buyer; otherwise it is released back to the seller's available balance. Neither outcome
   * touches the seller's settlement-time average.
   */
  @Transactional
  public Escrow resolveDispute(long escrowId, boolean favorBuyer, String caller, Instant now) {
    if (!arbitratorPolicy.isArbitrator(caller)) {
      throw new EscrowDomainException(
          EscrowErrorCode.UNAUTHORIZED, "Only the arbitrator may resolve escrow " + escrowId);
    }
    Escrow escrow =
        escrowRepository
            .findByIdForUpdate(escrowId)
            .orElseThrow(() -> EscrowEngineService.notFound(escrowId));
    escrow.requireStatus(EscrowStatus.DISPUTED);

    Escrow resolved = escrow.transitionTo(EscrowStatus.COMPLETED);
    escrowRepository.update(resolved);
    offerBookService.releaseEscrowSlot(escrow.offerId());
    if (favorBuyer) {
      balanceAccountingService.settle(escrow.seller(), escrow.amount());
      profileService.recordTrades(
          Map.of(
              escrow.buyer(), Profile::withCompletedTrade,
              escrow.seller(), Profile::withDisputedTrade));
      settlementLedger.transferOut(escrow.buyer(), escrow.amount());
    } else {
      balanceAccountingService.unlock(escrow.seller(), escrow.amount());
      profileService.recordTrades(
          Map.of(
              escrow.seller(), Profile::withCompletedTrade,
              escrow.buyer(), Profile::withDisputedTrade));
    }
    eventRecorder.record(
        EscrowEventRecorder.DISPUTE_RESOLVED,
        resolved,
        escrow.status(),
        caller,
        now,
        Map.of("favorBuyer", favorBuyer));
    log.info(
        "Dispute resolved escrowId={} favorBuyer={} buyer={} seller={} amount={}",
        escrowId,
        favorBuyer,
        escrow.buyer(),
        escrow.seller(),
        escrow.amount());
    return resolved;
  }
}
