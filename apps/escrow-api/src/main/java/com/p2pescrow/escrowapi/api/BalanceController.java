package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.balance.SellerBalance;
import com.p2pescrow.escrowapi.balances.BalanceAccountingService;
import com.p2pescrow.escrowapi.ledger.SettlementLedger;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/balances")
public class BalanceController {
  private final BalanceAccountingService balanceAccountingService;
  private final SettlementLedger settlementLedger;

  public BalanceController(
      BalanceAccountingService balanceAccountingService, SettlementLedger settlementLedger) {
    this.balanceAccountingService = balanceAccountingService;
    this.settlementLedger = settlementLedger;
  }

  @PostMapping("/deposits")
  public ResponseEntity<BalanceResponse> deposit(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody BalanceMovementRequest request) {
    SellerBalance balance = balanceAccountingService.deposit(jwt.getSubject(), request.amount());
    return ResponseEntity.ok(
        BalanceResponse.from(balance, settlementLedger.balanceOf(balance.principal())));
  }

  @PostMapping("/withdrawals")
  public ResponseEntity<BalanceResponse> withdraw(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody BalanceMovementRequest request) {
    SellerBalance balance = balanceAccountingService.withdraw(jwt.getSubject(), request.amount());
    return ResponseEntity.ok(
        BalanceResponse.from(balance, settlementLedger.balanceOf(balance.principal())));
  }

  @GetMapping("/{principal}")
  public ResponseEntity<BalanceResponse> getBalance(@PathVariable("principal") String principal) {
    return ResponseEntity.ok(
        new BalanceResponse(
            principal,
            balanceAccountingService.depositedBalance(principal),
            balanceAccountingService.availableBalance(principal),
            settlementLedger.balanceOf(principal)));
  }
}
