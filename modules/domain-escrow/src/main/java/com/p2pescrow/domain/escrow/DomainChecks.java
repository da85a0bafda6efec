package com.p2pescrow.domain.escrow;

import java.math.BigInteger;

final class DomainChecks {
  private DomainChecks() {}

  static void requirePrincipal(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_ADDRESS, fieldName + " must not be blank");
    }
  }

  static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_INPUT, fieldName + " must not be blank");
    }
  }

  static void requirePositive(BigInteger value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new EscrowDomainException(EscrowErrorCode.INVALID_INPUT, fieldName + " must be > 0");
    }
  }
}
