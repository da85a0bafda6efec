package com.p2pescrow.domain.escrow;

import java.util.Objects;

public class EscrowDomainException extends RuntimeException {
  private final EscrowErrorCode code;

  public EscrowDomainException(EscrowErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code must not be null");
  }

  public EscrowDomainException(EscrowErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code must not be null");
  }

  public EscrowErrorCode code() {
    return code;
  }
}
