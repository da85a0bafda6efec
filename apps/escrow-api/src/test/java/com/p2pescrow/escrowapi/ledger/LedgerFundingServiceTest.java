package com.p2pescrow.escrowapi.ledger;

import static com.p2pescrow.escrowapi.support.EscrowAssertions.assertFailsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.p2pescrow.domain.escrow.EscrowErrorCode;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LedgerFundingServiceTest {
  private JdbcSettlementLedger settlementLedger;
  private LedgerFundingService service;

  @BeforeEach
  void setUp() {
    settlementLedger = org.mockito.Mockito.mock(JdbcSettlementLedger.class);
    service = new LedgerFundingService(settlementLedger);
  }

  @Test
  void shouldCreditExternalAccount() {
    when(settlementLedger.credit("john", BigInteger.valueOf(250)))
        .thenReturn(BigInteger.valueOf(1250));

    LedgerCreditResult result = service.credit("john", BigInteger.valueOf(250), "ops-admin");

    assertEquals("john", result.principal());
    assertEquals(BigInteger.valueOf(250), result.credited());
    assertEquals(BigInteger.valueOf(1250), result.balance());
  }

  @Test
  void shouldRejectBlankPrincipal() {
    assertFailsWith(
        EscrowErrorCode.INVALID_ADDRESS, () -> service.credit(" ", BigInteger.ONE, "ops-admin"));
    verify(settlementLedger, never()).credit(anyString(), any());
  }

  @Test
  void shouldRejectNonPositiveAmount() {
    assertFailsWith(
        EscrowErrorCode.INVALID_INPUT, () -> service.credit("john", BigInteger.ZERO, "ops"));
    assertFailsWith(
        EscrowErrorCode.INVALID_INPUT,
        () -> service.credit("john", BigInteger.valueOf(-5), "ops"));
    verify(settlementLedger, never()).credit(anyString(), any());
  }
}
