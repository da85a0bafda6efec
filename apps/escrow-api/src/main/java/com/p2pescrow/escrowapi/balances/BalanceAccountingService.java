package com.p2pescrow.escrowapi.balances;

import com.p2pescrow.domain.balance.InsufficientBalanceException;
import com.p2pescrow.domain.balance.SellerBalance;
import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.escrowapi.ledger.SettlementLedger;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Custody bookkeeping per principal: what was deposited and how much of it is locked against
 * open escrows. {@link #lock}, {@link #unlock} and {@link #settle} are only called by escrow
 * transitions and always join the caller's transaction.
 */
@Service
public class BalanceAccountingService {
  private static final Logger log = LoggerFactory.getLogger(BalanceAccountingService.class);

  private final BalanceRepository balanceRepository;
  private final SettlementLedger settlementLedger;

  public BalanceAccountingService(
      BalanceRepository balanceRepository, SettlementLedger settlementLedger) {
    this.balanceRepository = balanceRepository;
    this.settlementLedger = settlementLedger;
  }

  @Transactional
  public SellerBalance deposit(String principal, BigInteger amount) {
    requirePrincipal(principal);
    requirePositive(amount);
    SellerBalance current = balanceRepository.lockOrCreate(principal);
    settlementLedger.transferIn(principal, amount);
    SellerBalance updated = current.deposit(amount);
    balanceRepository.update(updated);
    log.info(
        "Deposit recorded principal={} amount={} deposited={}",
        principal,
        amount,
        updated.deposited());
    return updated;
  }

  @Transactional
  public SellerBalance withdraw(String principal, BigInteger amount) {
    requirePrincipal(principal);
    requirePositive(amount);
    SellerBalance current = lockedBalance(principal, amount);
    SellerBalance updated = current.withdraw(amount);
    balanceRepository.update(updated);
    settlementLedger.transferOut(principal, amount);
    log.info(
        "Withdrawal recorded principal={} amount={} deposited={}",
        principal,
        amount,
        updated.deposited());
    return updated;
  }

  @Transactional
  public SellerBalance lock(String seller, BigInteger amount) {
    SellerBalance updated = lockedBalance(seller, amount).lock(amount);
    balanceRepository.update(updated);
    return updated;
  }

  @Transactional
  public SellerBalance unlock(String seller, BigInteger amount) {
    SellerBalance updated = existingBalance(seller).unlock(amount);
    balanceRepository.update(updated);
    return updated;
  }

  /** Releases the lock and removes the amount from custody; the caller pays it out. */
  @Transactional
  public SellerBalance settle(String seller, BigInteger amount) {
    SellerBalance updated = existingBalance(seller).settle(amount);
    balanceRepository.update(updated);
    return updated;
  }

  @Transactional(readOnly = true)
  public BigInteger depositedBalance(String principal) {
    return balanceRepository
        .findByPrincipal(principal)
        .map(SellerBalance::deposited)
        .orElse(BigInteger.ZERO);
  }

  @Transactional(readOnly = true)
  public BigInteger availableBalance(String principal) {
    return balanceRepository
        .findByPrincipal(principal)
        .map(SellerBalance::available)
        .orElse(BigInteger.ZERO);
  }

  private SellerBalance lockedBalance(String principal, BigInteger requested) {
    return balanceRepository
        .findByPrincipalForUpdate(principal)
        .orElseThrow(() -> new InsufficientBalanceException(principal, requested, BigInteger.ZERO));
  }

  private SellerBalance existingBalance(String principal) {
    return balanceRepository
        .findByPrincipalForUpdate(principal)
        .orElseThrow(() -> new IllegalStateException("No balance record for " + principal));
  }

  private static void requirePrincipal(String principal) {
    if (principal == null || principal.isBlank()) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_ADDRESS, "principal must not be blank");
    }
  }

  private static void requirePositive(BigInteger amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, "amount must be > 0");
    }
  }
}
