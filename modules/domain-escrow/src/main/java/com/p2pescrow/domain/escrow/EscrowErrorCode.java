package com.p2pescrow.domain.escrow;

public enum EscrowErrorCode {
  INVALID_INPUT(ErrorCategory.VALIDATION),
  INVALID_ADDRESS(ErrorCategory.VALIDATION),
  INVALID_PRICE_PARAMETERS(ErrorCategory.VALIDATION),
  CANNOT_TRADE_WITH_SELF(ErrorCategory.VALIDATION),
  TRADE_AMOUNT_TOO_LOW(ErrorCategory.VALIDATION),
  TRADE_AMOUNT_TOO_HIGH(ErrorCategory.VALIDATION),
  UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
  PROFILE_REQUIRED(ErrorCategory.NOT_FOUND),
  OFFER_NOT_FOUND(ErrorCategory.NOT_FOUND),
  ESCROW_NOT_FOUND(ErrorCategory.NOT_FOUND),
  ALREADY_EXISTS(ErrorCategory.STATE),
  OFFER_INACTIVE(ErrorCategory.STATE),
  INVALID_STATE(ErrorCategory.STATE),
  INSUFFICIENT_BALANCE(ErrorCategory.RESOURCE),
  ACTIVE_ESCROWS_EXIST(ErrorCategory.RESOURCE),
  ESCROW_TIMEOUT(ErrorCategory.TIMING),
  TRANSFER_FAILED(ErrorCategory.EXTERNAL);

  private final ErrorCategory category;

  EscrowErrorCode(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
