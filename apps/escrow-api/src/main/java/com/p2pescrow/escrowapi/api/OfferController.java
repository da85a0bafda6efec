package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Offer;
import com.p2pescrow.escrowapi.offers.CreateOfferCommand;
import com.p2pescrow.escrowapi.offers.OfferBookService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/offers")
public class OfferController {
  private final OfferBookService offerBookService;
  private final Clock clock;

  public OfferController(OfferBookService offerBookService, Clock clock) {
    this.offerBookService = offerBookService;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<OfferResponse> createOffer(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateOfferRequest request) {
    Offer offer =
        offerBookService.createOffer(
            new CreateOfferCommand(
                jwt.getSubject(),
                request.maxTradeAmount(),
                request.minTradeAmount(),
                request.unitPrice(),
                request.currency(),
                request.paymentMethod(),
                clock.instant()));
    return ResponseEntity.status(HttpStatus.CREATED).body(OfferResponse.from(offer));
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<OfferResponse> deactivateOffer(
      @AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
    Offer offer = offerBookService.deactivateOffer(id, jwt.getSubject());
    return ResponseEntity.ok(OfferResponse.from(offer));
  }

  @GetMapping("/{id}")
  public ResponseEntity<OfferResponse> getOffer(@PathVariable("id") long id) {
    return ResponseEntity.ok(OfferResponse.from(offerBookService.getOffer(id)));
  }

  /** Offers of one seller when {@code seller} is given, otherwise a page of active offers. */
  @GetMapping
  public ResponseEntity<List<OfferResponse>> listOffers(
      @RequestParam(name = "seller", required = false) String seller,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "20") int size) {
    List<Offer> offers;
    if (seller != null && !seller.isBlank()) {
      offers = offerBookService.findOffersBySeller(seller);
    } else {
      int clampedSize = Math.min(Math.max(size, 1), 100);
      offers = offerBookService.findActiveOffers(Math.max(page, 0) * clampedSize, clampedSize);
    }
    return ResponseEntity.ok(offers.stream().map(OfferResponse::from).toList());
  }
}
