package com.p2pescrow.domain.escrow;

public enum ErrorCategory {
  VALIDATION,
  AUTHORIZATION,
  NOT_FOUND,
  STATE,
  RESOURCE,
  TIMING,
  EXTERNAL
}
