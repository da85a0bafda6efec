package com.p2pescrow.escrowapi.api;

import com.p2pescrow.escrowapi.ledger.LedgerCreditResult;
import com.p2pescrow.escrowapi.ledger.LedgerFundingService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/ledger")
public class AdminLedgerController {
  private final LedgerFundingService ledgerFundingService;

  public AdminLedgerController(LedgerFundingService ledgerFundingService) {
    this.ledgerFundingService = ledgerFundingService;
  }

  @PostMapping("/credits")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<AdminLedgerCreditResponse> credit(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody AdminLedgerCreditRequest request) {
    LedgerCreditResult result =
        ledgerFundingService.credit(request.principal(), request.amount(), jwt.getSubject());
    return ResponseEntity.ok(AdminLedgerCreditResponse.from(result));
  }
}
