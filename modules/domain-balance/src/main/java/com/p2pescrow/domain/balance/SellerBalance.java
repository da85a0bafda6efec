package com.p2pescrow.domain.balance;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Custody balance of a single principal.
 *
 * <p>{@code deposited} is everything the principal has moved into custody and not yet withdrawn
 * or paid out; {@code locked} is the part of it reserved against open escrows. Instances are
 * immutable and every mutator returns a new value that still satisfies {@code 0 <= locked <=
 * deposited}.
 */
public record SellerBalance(String principal, BigInteger deposited, BigInteger locked) {

  public SellerBalance {
    Objects.requireNonNull(principal, "principal must not be null");
    Objects.requireNonNull(deposited, "deposited must not be null");
    Objects.requireNonNull(locked, "locked must not be null");
    if (locked.signum() < 0) {
      throw new BalanceDomainException("locked must be >= 0");
    }
    if (locked.compareTo(deposited) > 0) {
      throw new BalanceDomainException("locked must not exceed deposited");
    }
  }

  public static SellerBalance empty(String principal) {
    return new SellerBalance(principal, BigInteger.ZERO, BigInteger.ZERO);
  }

  public BigInteger available() {
    return deposited.subtract(locked);
  }

  public boolean canCover(BigInteger amount) {
    return available().compareTo(amount) >= 0;
  }

  public SellerBalance deposit(BigInteger amount) {
    requirePositive(amount);
    return new SellerBalance(principal, deposited.add(amount), locked);
  }

  public SellerBalance lock(BigInteger amount) {
    requirePositive(amount);
    requireAvailable(amount);
    return new SellerBalance(principal, deposited, locked.add(amount));
  }

  public SellerBalance unlock(BigInteger amount) {
    requirePositive(amount);
    if (locked.compareTo(amount) < 0) {
      throw new BalanceDomainException(
          "Cannot unlock " + amount + " for " + principal + ": only " + locked + " locked");
    }
    return new SellerBalance(principal, deposited, locked.subtract(amount));
  }

  /** Releases a lock and removes the same amount from custody. */
  public SellerBalance settle(BigInteger amount) {
    SellerBalance unlocked = unlock(amount);
    return new SellerBalance(principal, unlocked.deposited.subtract(amount), unlocked.locked);
  }

  public SellerBalance withdraw(BigInteger amount) {
    requirePositive(amount);
    requireAvailable(amount);
    return new SellerBalance(principal, deposited.subtract(amount), locked);
  }

  private void requireAvailable(BigInteger amount) {
    if (!canCover(amount)) {
      throw new InsufficientBalanceException(principal, amount, available());
    }
  }

  private static void requirePositive(BigInteger amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new BalanceDomainException("amount must be > 0");
    }
  }
}
