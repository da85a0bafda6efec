package com.p2pescrow.escrowapi.offers;

import com.p2pescrow.domain.escrow.Offer;
import java.util.List;
import java.util.Optional;

public interface OfferRepository {
  long nextId();

  void insert(Offer offer);

  Optional<Offer> findById(long offerId);

  Optional<Offer> findByIdForUpdate(long offerId);

  void update(Offer offer);

  /** Offers created by {@code seller}, oldest first. */
  List<Offer> findBySeller(String seller);

  List<Offer> findActive(int offset, int limit);
}
