package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Escrow;
import com.p2pescrow.escrowapi.disputes.DisputeResolutionService;
import com.p2pescrow.escrowapi.escrows.EscrowEngineService;
import com.p2pescrow.escrowapi.escrows.OpenEscrowCommand;
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
@RequestMapping("/v1/escrows")
public class EscrowController {
  private final EscrowEngineService escrowEngineService;
  private final DisputeResolutionService disputeResolutionService;
  private final Clock clock;

  public EscrowController(
      EscrowEngineService escrowEngineService,
      DisputeResolutionService disputeResolutionService,
      Clock clock) {
    this.escrowEngineService = escrowEngineService;
    this.disputeResolutionService = disputeResolutionService;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<EscrowResponse> openEscrow(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody OpenEscrowRequest request) {
    Escrow escrow =
        escrowEngineService.openEscrow(
            new OpenEscrowCommand(
                jwt.getSubject(), request.offerId(), request.amount(), clock.instant()));
    return ResponseEntity.status(HttpStatus.CREATED).body(EscrowResponse.from(escrow));
  }

  @PostMapping("/{id}/confirm")
  public ResponseEntity<EscrowResponse> confirmPayment(
      @AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
    Escrow escrow = escrowEngineService.confirmPayment(id, jwt.getSubject(), clock.instant());
    return ResponseEntity.ok(EscrowResponse.from(escrow));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<EscrowResponse> cancelEscrow(
      @AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
    Escrow escrow = escrowEngineService.cancelEscrow(id, jwt.getSubject(), clock.instant());
    return ResponseEntity.ok(EscrowResponse.from(escrow));
  }

  @PostMapping("/{id}/dispute")
  public ResponseEntity<EscrowResponse> raiseDispute(
      @AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
    Escrow escrow = escrowEngineService.raiseDispute(id, jwt.getSubject(), clock.instant());
    return ResponseEntity.ok(EscrowResponse.from(escrow));
  }

  @PostMapping("/{id}/resolve")
  public ResponseEntity<EscrowResponse> resolveDispute(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable("id") long id,
      @Valid @RequestBody ResolveDisputeRequest request) {
    Escrow escrow =
        disputeResolutionService.resolveDispute(
            id, request.favorBuyer(), jwt.getSubject(), clock.instant());
    return ResponseEntity.ok(EscrowResponse.from(escrow));
  }

  @GetMapping("/{id}")
  public ResponseEntity<EscrowResponse> getEscrow(@PathVariable("id") long id) {
    return ResponseEntity.ok(EscrowResponse.from(escrowEngineService.getEscrow(id)));
  }

  /** Escrows of {@code principal}, or of the caller when the parameter is omitted. */
  @GetMapping
  public ResponseEntity<List<EscrowResponse>> listEscrows(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(name = "principal", required = false) String principal) {
    String subject = principal == null || principal.isBlank() ? jwt.getSubject() : principal;
    return ResponseEntity.ok(
        escrowEngineService.findEscrowsByPrincipal(subject).stream()
            .map(EscrowResponse::from)
            .toList());
  }

  @GetMapping("/{id}/events")
  public ResponseEntity<List<EscrowEventResponse>> listEvents(@PathVariable("id") long id) {
    return ResponseEntity.ok(
        escrowEngineService.findEscrowEvents(id).stream()
            .map(EscrowEventResponse::from)
            .toList());
  }
}
