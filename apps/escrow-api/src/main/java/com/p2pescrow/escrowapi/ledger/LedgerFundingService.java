package com.p2pescrow.escrowapi.ledger;

import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LedgerFundingService {
  private static final Logger log = LoggerFactory.getLogger(LedgerFundingService.class);

  private final JdbcSettlementLedger settlementLedger;

  public LedgerFundingService(JdbcSettlementLedger settlementLedger) {
    this.settlementLedger = settlementLedger;
  }

  public LedgerCreditResult credit(String principal, BigInteger amount, String actor) {
    if (principal == null || principal.isBlank()) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_ADDRESS, "principal must not be blank");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "amount must be > 0");
    }
    BigInteger balance = settlementLedger.credit(principal, amount);
    log.info("Ledger credit posted principal={} amount={} actor={}", principal, amount, actor);
    return new LedgerCreditResult(principal, amount, balance);
  }
}
